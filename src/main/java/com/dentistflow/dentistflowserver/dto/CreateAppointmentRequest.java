package com.dentistflow.dentistflowserver.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Booking body. Times are RFC3339 strings, the patient is always the caller so there
 * is no patient field.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateAppointmentRequest {
    private String startTime;
    private String endTime;
    private String service;
}
