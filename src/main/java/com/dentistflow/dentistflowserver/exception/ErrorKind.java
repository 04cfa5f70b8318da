package com.dentistflow.dentistflowserver.exception;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;
    ErrorKind(HttpStatus status) { this.status = status; }

    public HttpStatus getStatus() { return status; }
}
