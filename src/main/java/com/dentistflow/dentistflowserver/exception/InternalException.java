package com.dentistflow.dentistflowserver.exception;

public class InternalException extends ClinicException {
    public InternalException(String message) {
        super(ErrorKind.INTERNAL, message);
    }

    public InternalException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
