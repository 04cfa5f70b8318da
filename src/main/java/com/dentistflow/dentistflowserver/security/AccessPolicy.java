package com.dentistflow.dentistflowserver.security;

import com.dentistflow.dentistflowserver.entity.Role;
import com.dentistflow.dentistflowserver.exception.PermissionDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Role based permissions. Services call {@link #check} before they touch the
 * repositories, so a denied request never reaches storage.
 */
@Component
@Slf4j
public class AccessPolicy {

    public boolean authorize(Role role, Operation operation) {
        if (role == null || operation == null) return false;
        return operation.getAllowedRoles().contains(role);
    }

    public void check(SessionPrincipal caller, Operation operation) {
        Role role = caller != null ? caller.getRole() : null;
        if (!authorize(role, operation)) {
            log.warn("Denied {} for user {} with role {}", operation,
                    caller != null ? caller.getUserId() : null, role);
            throw new PermissionDeniedException(operation.getDeniedMessage());
        }
    }
}
