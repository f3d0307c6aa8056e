package com.dental.clinic.dto;

import com.dental.clinic.entity.Appointment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

@Getter
@Builder
@AllArgsConstructor
public class AppointmentReminder {

    private final Long appointmentId;
    private final String patientName;
    private final String phoneNumber;
    private final String treatmentType;
    private final String dentist;
    private final LocalDate appointmentDate;

    public static AppointmentReminder from(Appointment a) {
        return AppointmentReminder.builder()
                .appointmentId(a.getId())
                .patientName(a.getPatient().getName())
                .phoneNumber(a.getPatient().getPhoneNumber())
                .treatmentType(a.getTreatmentType())
                .dentist(a.getDentist())
                .appointmentDate(a.getAppointmentDate())
                .build();
    }
}
