package com.dental.clinic.exception;

public class PatientNotFoundException extends RuntimeException {

    private final String phoneNumber;

    public PatientNotFoundException(String phoneNumber) {
        super("Patient not found: " + phoneNumber);
        this.phoneNumber = phoneNumber;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }
}
