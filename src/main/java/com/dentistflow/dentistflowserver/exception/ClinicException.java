package com.dentistflow.dentistflowserver.exception;

import lombok.Getter;

/**
 * Base of the errors services raise on purpose. The kind decides the HTTP status,
 * the message is shown to the caller as is.
 */
@Getter
public abstract class ClinicException extends RuntimeException {

    private final ErrorKind kind;

    protected ClinicException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ClinicException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
