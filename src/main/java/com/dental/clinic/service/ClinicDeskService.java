package com.dental.clinic.service;

import com.dental.clinic.dto.AppointmentDetails;
import com.dental.clinic.dto.AppointmentReminder;
import com.dental.clinic.dto.PatientRecord;
import com.dental.clinic.dto.RecordRow;
import com.dental.clinic.dto.VisitForm;
import com.dental.clinic.entity.Appointment;
import com.dental.clinic.entity.Patient;
import com.dental.clinic.exception.PatientNotFoundException;
import com.dental.clinic.exception.RecordStoreException;
import com.dental.clinic.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Front desk actions as the records screen issues them. Input is validated here before the
 * store is touched; storage failures come back as {@link RecordStoreException}.
 */
@Service
public class ClinicDeskService {

    private static final Logger log = LoggerFactory.getLogger(ClinicDeskService.class);

    public static final String NO_APPOINTMENTS_TODAY = "No appointments scheduled for today.";

    private final PatientRecordService records;
    private final Clock clock;

    public ClinicDeskService(PatientRecordService records, Clock clock) {
        this.records = records;
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    // =========================================================
    // RECORDS TABLE
    // =========================================================
    public List<RecordRow> showRecords(String term) {
        List<PatientRecord> patients = inStore("load records", () -> records.searchPatients(term));
        List<RecordRow> rows = new ArrayList<>();
        for (PatientRecord p : patients) {
            if (p.getAppointments().isEmpty()) {
                rows.add(new RecordRow(p.getName(), p.getPhoneNumber(),
                        StringUtils.defaultString(p.getTreatmentType()),
                        StringUtils.defaultString(p.getTeethLocation()),
                        "", "", "", "", ""));
                continue;
            }
            for (AppointmentDetails a : p.getAppointments()) {
                rows.add(new RecordRow(p.getName(), p.getPhoneNumber(),
                        StringUtils.defaultString(p.getTreatmentType()),
                        StringUtils.defaultString(p.getTeethLocation()),
                        a.getAppointmentDate().format(DateTimeFormatter.ISO_LOCAL_DATE),
                        a.getTreatmentType(),
                        a.getDentist(),
                        formatFee(a.getFee()),
                        StringUtils.defaultString(a.getNotes())));
            }
        }
        return rows;
    }

    // =========================================================
    // ADD PATIENT & APPOINTMENT
    // =========================================================
    public Appointment registerVisit(VisitForm form) {
        String name = InputValidator.requireText(form.getName(), "Patient name cannot be empty.");
        String phone = InputValidator.requirePhone(form.getPhone());
        String patientTreatment = StringUtils.trimToEmpty(form.getPatientTreatment());
        String teeth = StringUtils.trimToEmpty(form.getTeethLocation());

        if (form.getAppointmentDate() == null) {
            throw new ValidationException("Appointment date is required.");
        }
        String treatment = InputValidator.requireText(form.getAppointmentTreatment(),
                "Appointment treatment type is required.");
        String dentist = InputValidator.requireText(form.getDentist(), "Dentist name is required.");
        Double fee = InputValidator.optionalFee(form.getFee());
        String notes = StringUtils.trimToEmpty(form.getNotes());

        Appointment appointment = inStore("save patient and appointment", () -> records.registerVisit(
                name, phone, patientTreatment, teeth,
                form.getAppointmentDate(), treatment, dentist, fee, notes));

        log.info("Patient '{}' and appointment added", name);
        return appointment;
    }

    // =========================================================
    // MODIFY
    // =========================================================
    public Patient findForModification(String rawPhone) {
        return findExisting(rawPhone);
    }

    public Patient modifyPatient(String rawPhone, String name, String treatmentType, String teethLocation) {
        String phone = InputValidator.requirePhone(rawPhone);
        String newName = InputValidator.requireText(name, "Patient name cannot be empty.");

        return inStore("modify patient", () -> records.updatePatientFields(
                phone, newName,
                StringUtils.trimToEmpty(treatmentType),
                StringUtils.trimToEmpty(teethLocation)));
    }

    // =========================================================
    // DELETE
    // =========================================================
    public Patient findForDeletion(String rawPhone) {
        return findExisting(rawPhone);
    }

    public boolean deletePatient(String rawPhone) {
        String phone = InputValidator.requirePhone(rawPhone);
        return inStore("delete patient", () -> records.deletePatientByPhone(phone));
    }

    // =========================================================
    // REMINDERS
    // =========================================================
    public List<AppointmentReminder> remindersFor(LocalDate date) {
        return inStore("load reminders", () -> records.appointmentsOnDate(date));
    }

    public List<String> reminderLines(LocalDate date) {
        List<AppointmentReminder> due = remindersFor(date);
        if (due.isEmpty()) {
            return List.of(NO_APPOINTMENTS_TODAY);
        }
        List<String> lines = new ArrayList<>(due.size());
        for (AppointmentReminder r : due) {
            lines.add(String.format("%s has an appointment for %s with Dr. %s today (%s).",
                    r.getPatientName(),
                    r.getTreatmentType(),
                    r.getDentist(),
                    r.getAppointmentDate().format(DateTimeFormatter.ISO_LOCAL_DATE)));
        }
        return lines;
    }

    // =========================================================
    // HELPERS
    // =========================================================
    private Patient findExisting(String rawPhone) {
        String phone = InputValidator.requirePhone(rawPhone);
        return inStore("look up patient", () -> records.findPatientByPhone(phone))
                .orElseThrow(() -> new PatientNotFoundException(phone));
    }

    private static <T> T inStore(String action, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to {}; changes rolled back", action, e);
            throw new RecordStoreException("Could not " + action + ". No changes were saved.", e);
        }
    }

    static String formatFee(Double fee) {
        return fee == null ? "" : String.format(Locale.ROOT, "%.2f", fee);
    }
}
