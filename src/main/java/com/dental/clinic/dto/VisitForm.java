package com.dental.clinic.dto;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

/**
 * Raw input of the "add patient and appointment" form, exactly as typed.
 */
@Getter
@Builder
public class VisitForm {

    private final String name;
    private final String phone;
    private final String patientTreatment;
    private final String teethLocation;
    private final LocalDate appointmentDate;
    private final String appointmentTreatment;
    private final String dentist;
    private final String fee;
    private final String notes;
}
