package com.dental.clinic.service;

import lombok.Getter;

import java.time.LocalDate;

/**
 * Published after each refresh tick. Screens that hold rows reload them through
 * {@link ClinicDeskService#showRecords(String)}.
 */
@Getter
public class RecordsRefreshedEvent {

    private final LocalDate date;
    private final long appointmentsToday;

    public RecordsRefreshedEvent(LocalDate date, long appointmentsToday) {
        this.date = date;
        this.appointmentsToday = appointmentsToday;
    }
}
