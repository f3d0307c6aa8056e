package com.dental.clinic.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * One display line of the records table. Every column is a non-null string; missing values
 * are empty.
 */
@Getter
@AllArgsConstructor
public class RecordRow {

    public static final List<String> HEADERS = List.of(
            "Patient", "Phone", "Patient Treatment", "Teeth Location",
            "Appointment Date", "Treatment", "Dentist", "Fee", "Notes");

    private final String patient;
    private final String phone;
    private final String patientTreatment;
    private final String teethLocation;
    private final String appointmentDate;
    private final String treatment;
    private final String dentist;
    private final String fee;
    private final String notes;

    public List<String> cells() {
        return List.of(patient, phone, patientTreatment, teethLocation,
                appointmentDate, treatment, dentist, fee, notes);
    }
}
