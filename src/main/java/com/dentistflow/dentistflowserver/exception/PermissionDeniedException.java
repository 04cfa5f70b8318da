package com.dentistflow.dentistflowserver.exception;

public class PermissionDeniedException extends ClinicException {
    public PermissionDeniedException(String message) {
        super(ErrorKind.PERMISSION_DENIED, message);
    }
}
