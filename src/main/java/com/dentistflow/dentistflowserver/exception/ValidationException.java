package com.dentistflow.dentistflowserver.exception;

public class ValidationException extends ClinicException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
