package com.dental.clinic.dto;

import com.dental.clinic.entity.Appointment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

@Getter
@Builder
@AllArgsConstructor
public class AppointmentDetails {

    private final Long id;
    private final LocalDate appointmentDate;
    private final String treatmentType;
    private final String dentist;
    private final Double fee;
    private final String notes;

    public static AppointmentDetails from(Appointment a) {
        return AppointmentDetails.builder()
                .id(a.getId())
                .appointmentDate(a.getAppointmentDate())
                .treatmentType(a.getTreatmentType())
                .dentist(a.getDentist())
                .fee(a.getFee())
                .notes(a.getNotes())
                .build();
    }
}
