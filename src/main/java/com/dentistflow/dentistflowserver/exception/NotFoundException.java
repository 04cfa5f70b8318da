package com.dentistflow.dentistflowserver.exception;

public class NotFoundException extends ClinicException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
