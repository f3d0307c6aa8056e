package com.dental.clinic.repository;

import com.dental.clinic.entity.Patient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PatientRepository extends JpaRepository<Patient, Long> {

    Optional<Patient> findByPhoneNumber(String phoneNumber);

    List<Patient> findAllByOrderByIdAsc();

    /**
     * Case-insensitive "contains" over the patient columns and the treatment type of any owned
     * appointment. The term must already be lower case.
     */
    @Query("SELECT DISTINCT p FROM Patient p LEFT JOIN p.appointments a "
            + "WHERE LOCATE(:term, LOWER(p.name)) > 0 "
            + "OR LOCATE(:term, LOWER(p.phoneNumber)) > 0 "
            + "OR LOCATE(:term, LOWER(p.treatmentType)) > 0 "
            + "OR LOCATE(:term, LOWER(p.teethLocation)) > 0 "
            + "OR LOCATE(:term, LOWER(a.treatmentType)) > 0 "
            + "ORDER BY p.id ASC")
    List<Patient> search(@Param("term") String term);
}
