package com.dental.clinic.service;

import com.dental.clinic.dto.AppointmentDetails;
import com.dental.clinic.dto.AppointmentReminder;
import com.dental.clinic.dto.PatientRecord;
import com.dental.clinic.entity.Appointment;
import com.dental.clinic.entity.Patient;
import com.dental.clinic.exception.PatientNotFoundException;
import com.dental.clinic.exception.ValidationException;
import com.dental.clinic.repository.AppointmentRepository;
import com.dental.clinic.repository.PatientRepository;
import com.dental.clinic.teeth.TeethChart;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.hibernate.Hibernate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Patient and appointment storage. Each public method is one transaction: it either commits
 * completely or leaves no trace.
 */
@Service
@RequiredArgsConstructor
public class PatientRecordService {

    private static final Logger log = LoggerFactory.getLogger(PatientRecordService.class);

    private final PatientRepository patientRepository;
    private final AppointmentRepository appointmentRepository;

    // =========================================================
    // LOOKUP
    // =========================================================
    @Transactional(readOnly = true)
    public Optional<Patient> findPatientByPhone(String phone) {
        return patientRepository.findByPhoneNumber(phone);
    }

    @Transactional(readOnly = true)
    public List<PatientRecord> searchPatients(String term) {
        List<Patient> patients = StringUtils.isBlank(term)
                ? patientRepository.findAllByOrderByIdAsc()
                : patientRepository.search(term.trim().toLowerCase(Locale.ROOT));

        return patients.stream()
                .map(this::toRecord)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<AppointmentReminder> appointmentsOnDate(LocalDate date) {
        return appointmentRepository.findWithPatientByAppointmentDate(date).stream()
                .map(AppointmentReminder::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public long countAppointmentsOn(LocalDate date) {
        return appointmentRepository.countByAppointmentDate(date);
    }

    // =========================================================
    // PATIENTS
    // =========================================================
    @Transactional
    public Patient upsertPatient(String name, String phone, String treatmentType, String teethLocation) {
        if (StringUtils.isBlank(name)) {
            throw new ValidationException("Patient name cannot be empty.");
        }
        warnOnUnrecognizedTeeth(phone, teethLocation);

        Patient patient = patientRepository.findByPhoneNumber(phone).orElse(null);
        if (patient == null) {
            patient = Patient.builder()
                    .phoneNumber(phone)
                    .build();
            log.info("Creating patient {}", phone);
        } else {
            log.info("Updating existing patient {}", phone);
        }
        patient.setName(name);
        patient.setTreatmentType(treatmentType);
        patient.setTeethLocation(teethLocation);

        return patientRepository.save(patient);
    }

    @Transactional
    public Patient updatePatientFields(String phone, String name, String treatmentType, String teethLocation) {
        Patient patient = patientRepository.findByPhoneNumber(phone)
                .orElseThrow(() -> new PatientNotFoundException(phone));
        if (StringUtils.isBlank(name)) {
            throw new ValidationException("Patient name cannot be empty.");
        }
        warnOnUnrecognizedTeeth(phone, teethLocation);

        patient.setName(name);
        patient.setTreatmentType(treatmentType);
        patient.setTeethLocation(teethLocation);

        log.info("Updated patient {}", phone);
        return patientRepository.save(patient);
    }

    /**
     * Removes the patient's appointment rows, then the patient, in the same transaction.
     */
    @Transactional
    public boolean deletePatientByPhone(String phone) {
        Patient patient = patientRepository.findByPhoneNumber(phone)
                .orElseThrow(() -> new PatientNotFoundException(phone));

        int removed = appointmentRepository.deleteByPatientId(patient.getId());
        patientRepository.delete(patient);

        log.info("Deleted patient {} with {} appointment(s)", phone, removed);
        return true;
    }

    // =========================================================
    // APPOINTMENTS
    // =========================================================
    @Transactional
    public Appointment addAppointment(
            Patient patient,
            LocalDate date,
            String treatmentType,
            String dentist,
            Double fee,
            String notes
    ) {
        if (date == null) {
            throw new ValidationException("Appointment date is required.");
        }
        if (StringUtils.isBlank(treatmentType)) {
            throw new ValidationException("Appointment treatment type is required.");
        }
        if (StringUtils.isBlank(dentist)) {
            throw new ValidationException("Dentist name is required.");
        }
        if (fee != null && fee < 0) {
            throw new ValidationException("Fee must be a non-negative number.");
        }

        Appointment appointment = Appointment.builder()
                .patient(patient)
                .appointmentDate(date)
                .treatmentType(treatmentType)
                .dentist(dentist)
                .fee(fee)
                .notes(notes)
                .build();

        appointment = appointmentRepository.save(appointment);
        if (Hibernate.isInitialized(patient.getAppointments())) {
            patient.getAppointments().add(appointment);
        }

        log.info(
                "Added appointment: patient={} date={} treatment={} dentist={}",
                patient.getPhoneNumber(),
                date,
                treatmentType,
                dentist
        );
        return appointment;
    }

    /**
     * The "add patient and appointment" action: upsert by phone and attach a new appointment,
     * all or nothing.
     */
    @Transactional
    public Appointment registerVisit(
            String name,
            String phone,
            String patientTreatment,
            String teethLocation,
            LocalDate date,
            String appointmentTreatment,
            String dentist,
            Double fee,
            String notes
    ) {
        Patient patient = upsertPatient(name, phone, patientTreatment, teethLocation);
        return addAppointment(patient, date, appointmentTreatment, dentist, fee, notes);
    }

    // =========================================================
    // HELPERS
    // =========================================================
    private PatientRecord toRecord(Patient p) {
        List<AppointmentDetails> appointments = appointmentRepository
                .findByPatientIdOrderByAppointmentDateAscIdAsc(p.getId()).stream()
                .map(AppointmentDetails::from)
                .collect(Collectors.toList());

        return PatientRecord.builder()
                .id(p.getId())
                .name(p.getName())
                .phoneNumber(p.getPhoneNumber())
                .treatmentType(p.getTreatmentType())
                .teethLocation(p.getTeethLocation())
                .appointments(appointments)
                .build();
    }

    private static void warnOnUnrecognizedTeeth(String phone, String teethLocation) {
        List<String> unknown = TeethChart.unrecognized(TeethChart.parse(teethLocation));
        if (!unknown.isEmpty()) {
            log.warn("Storing unrecognized teeth tokens for {}: {}", phone, unknown);
        }
    }
}
