package com.dentistflow.dentistflowserver.security;

import com.dentistflow.dentistflowserver.entity.Role;
import com.dentistflow.dentistflowserver.exception.PermissionDeniedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessPolicyTest {

    private final AccessPolicy policy = new AccessPolicy();

    @Test
    void onlyClientsMayBook() {
        assertThat(policy.authorize(Role.CLIENT, Operation.BOOK_APPOINTMENT)).isTrue();
        assertThat(policy.authorize(Role.DENTIST, Operation.BOOK_APPOINTMENT)).isFalse();
        assertThat(policy.authorize(Role.STAFF, Operation.BOOK_APPOINTMENT)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(Role.class)
    void everyRoleMayList(Role role) {
        assertThat(policy.authorize(role, Operation.LIST_APPOINTMENTS)).isTrue();
        assertThat(policy.authorize(role, Operation.VIEW_PROFILE)).isTrue();
        assertThat(policy.authorize(role, Operation.UPDATE_PROFILE)).isTrue();
    }

    @Test
    void onlyDentistAndStaffMayModifyOrCancel() {
        for (Operation op : new Operation[]{Operation.MODIFY_APPOINTMENT, Operation.CANCEL_APPOINTMENT}) {
            assertThat(policy.authorize(Role.CLIENT, op)).isFalse();
            assertThat(policy.authorize(Role.DENTIST, op)).isTrue();
            assertThat(policy.authorize(Role.STAFF, op)).isTrue();
        }
    }

    @ParameterizedTest
    @EnumSource(Operation.class)
    void missingRoleIsAlwaysDenied(Operation operation) {
        assertThat(policy.authorize(null, operation)).isFalse();
    }

    @Test
    void checkThrowsWithOperationMessage() {
        SessionPrincipal staff = new SessionPrincipal(7L, Role.STAFF);

        assertThatThrownBy(() -> policy.check(staff, Operation.BOOK_APPOINTMENT))
                .isInstanceOf(PermissionDeniedException.class)
                .hasMessage("Only clients can book appointments.");
        assertThatCode(() -> policy.check(staff, Operation.CANCEL_APPOINTMENT)).doesNotThrowAnyException();
        assertThatThrownBy(() -> policy.check(null, Operation.LIST_APPOINTMENTS))
                .isInstanceOf(PermissionDeniedException.class);
    }
}
