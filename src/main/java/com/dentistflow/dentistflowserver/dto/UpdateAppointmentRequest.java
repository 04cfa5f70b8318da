package com.dentistflow.dentistflowserver.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Sparse update; a {@code null} field means "leave unchanged". */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAppointmentRequest {
    private String startTime;
    private String endTime;
    private String service;
    private String status;
}
