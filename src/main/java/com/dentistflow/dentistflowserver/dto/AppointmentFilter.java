package com.dentistflow.dentistflowserver.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Query string filters of the appointment lists, e.g.
 * {@code ?startDate=2024-07-01&endDate=2024-07-31&status=Scheduled}.
 * {@code patientId} is only honored for dentists and staff.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentFilter {
    private String startDate;
    private String endDate;
    private String status;
    private String patientId;
}
