package com.dental.clinic.repository;

import com.dental.clinic.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    List<Appointment> findByPatientIdOrderByAppointmentDateAscIdAsc(Long patientId);

    @Query("SELECT a FROM Appointment a JOIN FETCH a.patient WHERE a.appointmentDate = :date ORDER BY a.id ASC")
    List<Appointment> findWithPatientByAppointmentDate(@Param("date") LocalDate date);

    long countByAppointmentDate(LocalDate appointmentDate);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Appointment a WHERE a.patient.id = :patientId")
    int deleteByPatientId(@Param("patientId") Long patientId);
}
