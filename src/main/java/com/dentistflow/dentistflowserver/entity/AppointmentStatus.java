package com.dentistflow.dentistflowserver.entity;

/**
 * Well-known appointment status tags. Status is stored as free text, staff may set
 * other values through an update.
 */
public final class AppointmentStatus {
    public static final String SCHEDULED = "Scheduled";
    public static final String CANCELLED = "Cancelled";

    private AppointmentStatus() {
    }
}
