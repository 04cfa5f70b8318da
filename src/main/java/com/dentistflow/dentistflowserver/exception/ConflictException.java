package com.dentistflow.dentistflowserver.exception;

public class ConflictException extends ClinicException {
    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
