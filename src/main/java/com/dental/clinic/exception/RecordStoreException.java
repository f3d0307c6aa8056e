package com.dental.clinic.exception;

/**
 * A unit of work failed inside the store and was rolled back. The message is safe to show to
 * the user; the cause carries the storage detail.
 */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
