package com.dentistflow.dentistflowserver.security;

import com.dentistflow.dentistflowserver.entity.Role;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Identity carried by a validated session token. */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class SessionPrincipal {
    private final Long userId;
    private final Role role;
}
