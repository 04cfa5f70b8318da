package com.dentistflow.dentistflowserver.services;

import org.springframework.data.domain.Sort;

/** The two orderings exposed by the appointment list endpoints. */
public enum AppointmentListOrder {
    /** Ascending start time, groups a day's appointments together. */
    CHRONOLOGICAL(Sort.Direction.ASC),
    /** Descending start time. */
    NEWEST_FIRST(Sort.Direction.DESC);

    private final Sort.Direction direction;
    AppointmentListOrder(Sort.Direction direction) { this.direction = direction; }

    public Sort toSort() {
        return Sort.by(direction, "startTime").and(Sort.by(direction, "id"));
    }
}
