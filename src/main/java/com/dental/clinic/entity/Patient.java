package com.dental.clinic.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "patients", indexes = {
    @Index(name = "idx_phone", columnList = "phone_number")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Patient {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_name", nullable = false, length = 100)
    private String name;

    /** Natural key: add/modify/delete all address a patient by phone. */
    @Column(name = "phone_number", nullable = false, unique = true, length = 20)
    private String phoneNumber;

    @Column(name = "treatment_type", length = 100)
    private String treatmentType;

    /** Serialized teeth selection, e.g. "LL1, UR3". */
    @Column(name = "teeth_location", length = 400)
    private String teethLocation;

    // Read side only; rows are removed explicitly by PatientRecordService before the patient.
    @OneToMany(mappedBy = "patient")
    @OrderBy("appointmentDate ASC, id ASC")
    @Builder.Default
    private List<Appointment> appointments = new ArrayList<>();
}
