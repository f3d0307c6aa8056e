package com.dental.clinic.console;

import com.dental.clinic.config.ClinicCatalog;
import com.dental.clinic.dto.RecordRow;
import com.dental.clinic.dto.VisitForm;
import com.dental.clinic.entity.Patient;
import com.dental.clinic.exception.PatientNotFoundException;
import com.dental.clinic.exception.RecordStoreException;
import com.dental.clinic.service.ClinicDeskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ConsoleSessionTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    ClinicDeskService desk;
    ClinicCatalog catalog;
    StringWriter output;

    @BeforeEach
    void setup() {
        desk = mock(ClinicDeskService.class);
        catalog = new ClinicCatalog(List.of("Cleaning", "Filling"), List.of("Mohamed", "Essam", "Noha"));
        output = new StringWriter();
        when(desk.today()).thenReturn(TODAY);
        when(desk.showRecords(any())).thenReturn(List.of(
                new RecordRow("Ann", "+10000000", "Cleaning", "", "2026-10-19", "Filling", "Noha", "", "")));
    }

    private String run(String... lines) {
        String input = String.join("\n", lines) + "\n";
        new ConsoleSession(desk, catalog, new BufferedReader(new StringReader(input)), new PrintWriter(output)).run();
        return output.toString();
    }

    @Test
    void listsRecordsOnStartAndExits() {
        String out = run("exit");

        assertTrue(out.contains("Patient"));
        assertTrue(out.contains("+10000000"));
        assertTrue(out.contains("1 row(s)"));
        assertTrue(out.endsWith("Bye.\n") || out.endsWith("Bye." + System.lineSeparator()));
    }

    @Test
    void searchPassesTerm() {
        run("search clean", "exit");
        verify(desk).showRecords("clean");
    }

    @Test
    void addCollectsTheWholeForm() {
        run("add",
                "Ann", "+10000000", "Cleaning",
                "y", "UL3", "LL1", "UL3", "ok",
                "2026-10-21", "2", "3", "25.5", "bring x-ray",
                "exit");

        ArgumentCaptor<VisitForm> captor = ArgumentCaptor.forClass(VisitForm.class);
        verify(desk).registerVisit(captor.capture());
        VisitForm form = captor.getValue();
        assertEquals("Ann", form.getName());
        assertEquals("+10000000", form.getPhone());
        assertEquals("LL1", form.getTeethLocation());
        assertEquals(LocalDate.of(2026, 10, 21), form.getAppointmentDate());
        assertEquals("Filling", form.getAppointmentTreatment());
        assertEquals("Noha", form.getDentist());
        assertEquals("25.5", form.getFee());
        assertEquals("bring x-ray", form.getNotes());
    }

    @Test
    void blankDateMeansToday() {
        run("add", "Ann", "+10000000", "", "n", "", "Filling", "Essam", "", "", "exit");

        ArgumentCaptor<VisitForm> captor = ArgumentCaptor.forClass(VisitForm.class);
        verify(desk).registerVisit(captor.capture());
        assertEquals(TODAY, captor.getValue().getAppointmentDate());
        assertEquals("", captor.getValue().getTeethLocation());
    }

    @Test
    void badDateIsReportedAndSessionContinues() {
        String out = run("add", "Ann", "+10000000", "", "n", "21/10/2026", "reminders", "exit");

        assertTrue(out.contains("Error: Invalid date: 21/10/2026"));
        verify(desk, never()).registerVisit(any());
        verify(desk).reminderLines(TODAY);
    }

    @Test
    void deleteAsksForConfirmation() {
        Patient ann = Patient.builder().name("Ann").phoneNumber("+10000000").build();
        when(desk.findForDeletion("+10000000")).thenReturn(ann);

        String out = run("delete +10000000", "n", "delete +10000000", "y", "exit");

        assertTrue(out.contains("Are you sure you want to delete patient 'Ann'?"));
        assertTrue(out.contains("Not deleted."));
        verify(desk, times(1)).deletePatient("+10000000");
        assertTrue(out.contains("Patient with phone '+10000000' deleted."));
    }

    @Test
    void unknownPatientIsReported() {
        when(desk.findForModification("+99999999")).thenThrow(new PatientNotFoundException("+99999999"));

        String out = run("modify +99999999", "exit");

        assertTrue(out.contains("Error: Patient not found: +99999999"));
        verify(desk, never()).modifyPatient(anyString(), anyString(), any(), any());
    }

    @Test
    void modifyKeepsBlankFields() {
        Patient ann = Patient.builder().name("Ann").phoneNumber("+10000000")
                .treatmentType("Cleaning").teethLocation("UL1").build();
        when(desk.findForModification("+10000000")).thenReturn(ann);

        run("modify +10000000", "", "Implant", "y", "UR2", "ok", "exit");

        verify(desk).modifyPatient("+10000000", "Ann", "Implant", "UL1, UR2");
    }

    @Test
    void dashClearsTreatment() {
        Patient ann = Patient.builder().name("Ann").phoneNumber("+10000000")
                .treatmentType("Cleaning").teethLocation("UL1").build();
        when(desk.findForModification("+10000000")).thenReturn(ann);

        run("modify +10000000", "", "-", "n", "exit");

        verify(desk).modifyPatient("+10000000", "Ann", "", "UL1");
    }

    @Test
    void commandsAndTeethIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            String out = run("LIST", "teeth", "ul1", "ok", "EXIT");

            assertFalse(out.contains("Unknown command"));
            assertTrue(out.contains("Selection: UL1"));
            verify(desk, times(2)).showRecords(null);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void storeFailureIsPrinted() {
        when(desk.reminderLines(TODAY)).thenThrow(new RecordStoreException("Could not load reminders. No changes were saved.", null));

        String out = run("reminders", "list", "exit");

        assertTrue(out.contains("Error: Could not load reminders."));
        verify(desk, times(2)).showRecords(null);
    }

    @Test
    void teethSelectorRejectsUnknownTokensAndCancelKeepsInitial() {
        String out = run("teeth LR3", "XX9", "UL1", "cancel", "exit");

        assertTrue(out.contains("Not a tooth: XX9"));
        assertTrue(out.contains("Selection: LR3"));
    }

    @Test
    void endOfInputInsideFormEndsSession() {
        String out = run("add", "Ann");

        assertTrue(out.contains("Cancelled."));
        verify(desk, never()).registerVisit(any());
    }
}
