package com.dental.clinic.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClinicCatalogTest {

    private final List<String> dentists = List.of("Mohamed", "Essam", "Noha");

    @Test
    void numberPicksOption() {
        assertEquals("Mohamed", ClinicCatalog.pick(dentists, "1"));
        assertEquals("Noha", ClinicCatalog.pick(dentists, " 3 "));
    }

    @Test
    void otherInputIsKeptAsTyped() {
        assertEquals("Dr. Salma", ClinicCatalog.pick(dentists, "Dr. Salma "));
        assertEquals("4", ClinicCatalog.pick(dentists, "4"));
        assertEquals("", ClinicCatalog.pick(dentists, ""));
        assertNull(ClinicCatalog.pick(dentists, null));
    }
}
