package com.dentistflow.dentistflowserver.exception;

public class UnauthorizedException extends ClinicException {
    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
