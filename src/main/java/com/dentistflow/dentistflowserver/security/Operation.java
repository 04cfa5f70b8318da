package com.dentistflow.dentistflowserver.security;

import com.dentistflow.dentistflowserver.entity.Role;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum Operation {
    BOOK_APPOINTMENT("Only clients can book appointments.", Role.CLIENT),
    LIST_APPOINTMENTS("Permission denied.", Role.CLIENT, Role.DENTIST, Role.STAFF),
    VIEW_APPOINTMENT("Permission denied.", Role.CLIENT, Role.DENTIST, Role.STAFF),
    MODIFY_APPOINTMENT("Permission denied.", Role.DENTIST, Role.STAFF),
    CANCEL_APPOINTMENT("Permission denied.", Role.DENTIST, Role.STAFF),
    VIEW_PROFILE("Permission denied.", Role.CLIENT, Role.DENTIST, Role.STAFF),
    UPDATE_PROFILE("Permission denied.", Role.CLIENT, Role.DENTIST, Role.STAFF);

    private final String deniedMessage;
    private final Set<Role> allowedRoles;

    Operation(String deniedMessage, Role first, Role... rest) {
        this.deniedMessage = deniedMessage;
        this.allowedRoles = Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    public String getDeniedMessage() { return deniedMessage; }

    public Set<Role> getAllowedRoles() { return allowedRoles; }
}
