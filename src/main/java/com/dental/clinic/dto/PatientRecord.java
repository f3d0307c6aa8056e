package com.dental.clinic.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * A patient with its appointments, detached from the persistence context. Appointments are in
 * date order.
 */
@Getter
@Builder
@AllArgsConstructor
public class PatientRecord {

    private final Long id;
    private final String name;
    private final String phoneNumber;
    private final String treatmentType;
    private final String teethLocation;
    private final List<AppointmentDetails> appointments;
}
