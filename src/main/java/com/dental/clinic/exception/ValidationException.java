package com.dental.clinic.exception;

/**
 * Raised for bad form input before any store access is attempted.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
