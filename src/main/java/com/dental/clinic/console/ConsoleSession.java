package com.dental.clinic.console;

import com.dental.clinic.config.ClinicCatalog;
import com.dental.clinic.dto.RecordRow;
import com.dental.clinic.dto.VisitForm;
import com.dental.clinic.entity.Patient;
import com.dental.clinic.exception.PatientNotFoundException;
import com.dental.clinic.exception.RecordStoreException;
import com.dental.clinic.exception.ValidationException;
import com.dental.clinic.service.ClinicDeskService;
import com.dental.clinic.teeth.TeethChart;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Line-oriented front end for the records screen. One command runs to completion before the
 * next line is read. Errors are printed and the session carries on.
 */
public class ConsoleSession {

    private static final Logger log = LoggerFactory.getLogger(ConsoleSession.class);

    private static final String PROMPT = "clinic> ";
    static final String CLEAR = "-";

    private final ClinicDeskService desk;
    private final ClinicCatalog catalog;
    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleSession(ClinicDeskService desk, ClinicCatalog catalog, BufferedReader in, PrintWriter out) {
        this.desk = desk;
        this.catalog = catalog;
        this.in = in;
        this.out = out;
    }

    public void run() {
        out.println("Dentistry Clinic Management System. Type 'help' for commands.");
        printRecords(null);
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = readLine();
            if (line == null) {
                break;
            }
            if (!dispatch(line.trim())) {
                break;
            }
        }
        out.println("Bye.");
        out.flush();
    }

    /** Returns false when the session should end. */
    boolean dispatch(String line) {
        if (line.isEmpty()) {
            return true;
        }
        String command = StringUtils.substringBefore(line, " ").toLowerCase(Locale.ROOT);
        String argument = StringUtils.substringAfter(line, " ").trim();

        try {
            switch (command) {
                case "exit":
                case "quit":
                    return false;
                case "help":
                    printHelp();
                    break;
                case "list":
                case "refresh":
                    printRecords(null);
                    break;
                case "search":
                    printRecords(argument);
                    break;
                case "add":
                    addPatientAndAppointment();
                    break;
                case "modify":
                    modifyPatient(argument);
                    break;
                case "delete":
                    deletePatient(argument);
                    break;
                case "reminders":
                    desk.reminderLines(desk.today()).forEach(out::println);
                    break;
                case "teeth":
                    out.println("Selection: " + selectTeeth(argument));
                    break;
                default:
                    out.println("Unknown command: " + command + ". Type 'help'.");
            }
        } catch (ValidationException | PatientNotFoundException e) {
            out.println("Error: " + e.getMessage());
        } catch (RecordStoreException e) {
            log.warn("Command '{}' failed: {}", command, e.getMessage());
            out.println("Error: " + e.getMessage());
        } catch (FormCancelledException e) {
            out.println("Cancelled.");
        }
        out.flush();
        return true;
    }

    // =========================================================
    // COMMANDS
    // =========================================================
    private void printHelp() {
        out.println("list                 show all records");
        out.println("search <term>        filter by name, phone, treatment or teeth");
        out.println("add                  add a patient and an appointment");
        out.println("modify <phone>       change a patient's details");
        out.println("delete <phone>       delete a patient and all appointments");
        out.println("reminders            appointments scheduled for today");
        out.println("teeth [selection]    try the teeth selector");
        out.println("exit                 leave");
    }

    private void printRecords(String term) {
        List<RecordRow> rows = desk.showRecords(term);
        RecordTableFormatter.table(rows).forEach(out::println);
        out.println(rows.size() + " row(s)");
    }

    private void addPatientAndAppointment() {
        out.println("-- Patient Info");
        String name = ask("Patient Name");
        String phone = ask("Phone Number");
        String patientTreatment = ask("Patient Treatment");
        String teeth = askYesNo("Select teeth?") ? selectTeeth("") : "";

        out.println("-- Appointment Info");
        LocalDate date = askDate("Appointment Date (yyyy-mm-dd, blank for today)");
        String treatment = ClinicCatalog.pick(catalog.getTreatments(),
                askFrom("Treatment Type", catalog.getTreatments()));
        String dentist = ClinicCatalog.pick(catalog.getDentists(),
                askFrom("Dentist", catalog.getDentists()));
        String fee = ask("Fee");
        String notes = ask("Notes");

        desk.registerVisit(VisitForm.builder()
                .name(name)
                .phone(phone)
                .patientTreatment(patientTreatment)
                .teethLocation(teeth)
                .appointmentDate(date)
                .appointmentTreatment(treatment)
                .dentist(dentist)
                .fee(fee)
                .notes(notes)
                .build());
        out.println("Patient '" + name.trim() + "' and appointment added successfully.");
        printRecords(null);
    }

    private void modifyPatient(String argument) {
        String phone = StringUtils.isBlank(argument) ? ask("Enter Patient Phone Number to Modify") : argument;
        Patient patient = desk.findForModification(phone);

        out.println("-- Modify " + patient.getName() + " (blank keeps the current value, '" + CLEAR + "' clears it)");
        String name = StringUtils.defaultIfBlank(ask("Patient Name [" + patient.getName() + "]"), patient.getName());
        String treatment = keepOrClear(
                ask("Patient Treatment [" + StringUtils.defaultString(patient.getTreatmentType()) + "]"),
                patient.getTreatmentType());
        String teeth = StringUtils.defaultString(patient.getTeethLocation());
        if (askYesNo("Change teeth [" + teeth + "]?")) {
            teeth = selectTeeth(teeth);
        }

        desk.modifyPatient(phone, name, treatment, teeth);
        out.println("Patient details updated.");
        printRecords(null);
    }

    /** Blank keeps {@code current}, {@link #CLEAR} empties the field, anything else replaces it. */
    static String keepOrClear(String answer, String current) {
        if (CLEAR.equals(answer)) {
            return "";
        }
        return StringUtils.defaultIfBlank(answer, current);
    }

    private void deletePatient(String argument) {
        String phone = StringUtils.isBlank(argument) ? ask("Enter Patient Phone Number") : argument;
        Patient patient = desk.findForDeletion(phone);
        if (!askYesNo("Are you sure you want to delete patient '" + patient.getName() + "'?")) {
            out.println("Not deleted.");
            return;
        }
        desk.deletePatient(phone);
        out.println("Patient with phone '" + patient.getPhoneNumber() + "' deleted.");
        printRecords(null);
    }

    /**
     * Interactive selector: each entered tooth id toggles, 'ok' accepts, 'cancel' keeps the
     * initial selection.
     */
    String selectTeeth(String initial) {
        Set<String> selection = TeethChart.parse(initial);
        while (true) {
            RecordTableFormatter.chart(selection).forEach(out::println);
            out.print("Toggle tooth (e.g. UL3), 'ok' or 'cancel': ");
            out.flush();
            String input = readLine();
            if (input == null || "cancel".equalsIgnoreCase(input.trim())) {
                return TeethChart.serialize(TeethChart.parse(initial));
            }
            String token = input.trim().toUpperCase(Locale.ROOT);
            if ("OK".equals(token)) {
                return TeethChart.serialize(selection);
            }
            if (!TeethChart.isToothId(token)) {
                out.println("Not a tooth: " + input.trim());
                continue;
            }
            selection = TeethChart.toggle(selection, token);
        }
    }

    // =========================================================
    // PROMPTS
    // =========================================================
    private String ask(String label) {
        out.print(label + ": ");
        out.flush();
        String line = readLine();
        if (line == null) {
            throw new FormCancelledException();
        }
        return line.trim();
    }

    private String askFrom(String label, List<String> options) {
        for (int i = 0; i < options.size(); i++) {
            out.println("  " + (i + 1) + ") " + options.get(i));
        }
        return ask(label);
    }

    private boolean askYesNo(String question) {
        String answer = ask(question + " (y/n)");
        return answer.equalsIgnoreCase("y") || answer.equalsIgnoreCase("yes");
    }

    private LocalDate askDate(String label) {
        String raw = ask(label);
        if (raw.isEmpty()) {
            return desk.today();
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid date: " + raw);
        }
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Input ended in the middle of a form. */
    static class FormCancelledException extends RuntimeException {
        FormCancelledException() {
            super("Input closed");
        }
    }
}
