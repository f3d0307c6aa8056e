package com.dental.clinic.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Choices offered by the appointment form. Free text is still accepted.
 */
@Component
public class ClinicCatalog {

    private final List<String> treatments;
    private final List<String> dentists;

    public ClinicCatalog(
            @Value("${clinic.catalog.treatments:Cleaning,Filling,Extraction,Whitening,Implant,Root Canal,Crown,Other}")
            List<String> treatments,
            @Value("${clinic.catalog.dentists:Mohamed,Essam,Noha}")
            List<String> dentists) {
        this.treatments = List.copyOf(treatments);
        this.dentists = List.copyOf(dentists);
    }

    public List<String> getTreatments() {
        return treatments;
    }

    public List<String> getDentists() {
        return dentists;
    }

    /**
     * A 1-based number picks from {@code options}; any other text is taken as typed.
     */
    public static String pick(List<String> options, String input) {
        if (input == null) {
            return null;
        }
        String trimmed = input.trim();
        if (trimmed.matches("\\d{1,3}")) {
            int index = Integer.parseInt(trimmed) - 1;
            if (index >= 0 && index < options.size()) {
                return options.get(index);
            }
        }
        return trimmed;
    }
}
