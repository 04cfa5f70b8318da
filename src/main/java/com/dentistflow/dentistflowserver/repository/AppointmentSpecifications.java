package com.dentistflow.dentistflowserver.repository;

import com.dentistflow.dentistflowserver.entity.Appointment;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

/**
 * Building blocks for appointment list queries. A {@code null} argument yields a
 * {@code null} specification, which Spring Data ignores when combined.
 */
public final class AppointmentSpecifications {

    private AppointmentSpecifications() {
    }

    public static Specification<Appointment> forPatient(Long patientId) {
        if (patientId == null) return null;
        return (root, query, cb) -> cb.equal(root.get("patientId"), patientId);
    }

    /** {@code startTime >= from}, inclusive. */
    public static Specification<Appointment> startingFrom(Instant from) {
        if (from == null) return null;
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<Instant>get("startTime"), from);
    }

    /** {@code startTime <= until}, inclusive. */
    public static Specification<Appointment> startingUntil(Instant until) {
        if (until == null) return null;
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.<Instant>get("startTime"), until);
    }

    public static Specification<Appointment> withStatus(String status) {
        if (status == null || status.isEmpty()) return null;
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<Appointment> matching(Long patientId, Instant from, Instant until, String status) {
        return Specification.where(forPatient(patientId))
                .and(startingFrom(from))
                .and(startingUntil(until))
                .and(withStatus(status));
    }
}
