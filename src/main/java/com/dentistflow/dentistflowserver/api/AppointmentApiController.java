package com.dentistflow.dentistflowserver.api;

import com.dentistflow.dentistflowserver.dto.ApiResponse;
import com.dentistflow.dentistflowserver.dto.AppointmentFilter;
import com.dentistflow.dentistflowserver.dto.CreateAppointmentRequest;
import com.dentistflow.dentistflowserver.dto.UpdateAppointmentRequest;
import com.dentistflow.dentistflowserver.entity.Appointment;
import com.dentistflow.dentistflowserver.security.SessionPrincipal;
import com.dentistflow.dentistflowserver.services.AppointmentListOrder;
import com.dentistflow.dentistflowserver.services.AppointmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AppointmentApiController {

    private final AppointmentService appointmentService;

    /**
     * Filtered list sorted by start time ascending, e.g.
     * {@code /api/appointments?startDate=2024-07-01&endDate=2024-07-31&status=Scheduled}.
     */
    @GetMapping("/appointments")
    public List<Appointment> getAppointments(@AuthenticationPrincipal SessionPrincipal caller,
                                             AppointmentFilter filter) {
        return appointmentService.listAppointments(caller, filter, AppointmentListOrder.CHRONOLOGICAL);
    }

    /**
     * Same filters, newest first. The path id is not used for scoping: clients get
     * their own appointments, dentists and staff narrow with {@code ?patientId=}.
     */
    @GetMapping("/appointment/user/{id}")
    public List<Appointment> getUserAppointments(@AuthenticationPrincipal SessionPrincipal caller,
                                                 @PathVariable("id") String ignoredUserId,
                                                 AppointmentFilter filter) {
        return appointmentService.listAppointments(caller, filter, AppointmentListOrder.NEWEST_FIRST);
    }

    @GetMapping("/appointments/{id}")
    public Appointment getAppointment(@AuthenticationPrincipal SessionPrincipal caller,
                                      @PathVariable Long id) {
        return appointmentService.getAppointment(caller, id);
    }

    @PostMapping("/appointments")
    public ResponseEntity<Appointment> createAppointment(@AuthenticationPrincipal SessionPrincipal caller,
                                                         @RequestBody CreateAppointmentRequest request) {
        Appointment created = appointmentService.createAppointment(caller, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/appointments/{id}")
    public ApiResponse<Appointment> updateAppointment(@AuthenticationPrincipal SessionPrincipal caller,
                                                      @PathVariable Long id,
                                                      @RequestBody UpdateAppointmentRequest request) {
        Appointment updated = appointmentService.updateAppointment(caller, id, request);
        return ApiResponse.ok("Appointment updated successfully", updated);
    }

    @PatchMapping("/appointments/{id}/cancel")
    public ApiResponse<Appointment> cancelAppointment(@AuthenticationPrincipal SessionPrincipal caller,
                                                      @PathVariable Long id) {
        Appointment cancelled = appointmentService.cancelAppointment(caller, id);
        return ApiResponse.ok("Appointment cancelled successfully", cancelled);
    }
}
