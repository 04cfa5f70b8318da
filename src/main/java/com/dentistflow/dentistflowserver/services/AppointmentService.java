package com.dentistflow.dentistflowserver.services;

import com.dentistflow.dentistflowserver.converter.TimestampParser;
import com.dentistflow.dentistflowserver.dto.AppointmentFilter;
import com.dentistflow.dentistflowserver.dto.CreateAppointmentRequest;
import com.dentistflow.dentistflowserver.dto.UpdateAppointmentRequest;
import com.dentistflow.dentistflowserver.entity.Appointment;
import com.dentistflow.dentistflowserver.entity.AppointmentStatus;
import com.dentistflow.dentistflowserver.entity.Role;
import com.dentistflow.dentistflowserver.entity.User;
import com.dentistflow.dentistflowserver.exception.NotFoundException;
import com.dentistflow.dentistflowserver.exception.ValidationException;
import com.dentistflow.dentistflowserver.repository.AppointmentRepository;
import com.dentistflow.dentistflowserver.repository.AppointmentSpecifications;
import com.dentistflow.dentistflowserver.security.AccessPolicy;
import com.dentistflow.dentistflowserver.security.Operation;
import com.dentistflow.dentistflowserver.security.SessionPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AppointmentService {

    private final AppointmentRepository appointmentRepository;
    private final UserService userService;
    private final NotificationService notificationService;
    private final AccessPolicy accessPolicy;

    // =========================================================
    // CREATE
    // =========================================================

    /**
     * Books an appointment for the calling client. The patient is always the caller,
     * the patient name is copied from the caller's profile at this moment.
     */
    @Transactional
    public Appointment createAppointment(SessionPrincipal caller, CreateAppointmentRequest request) {
        accessPolicy.check(caller, Operation.BOOK_APPOINTMENT);

        Instant startTime;
        Instant endTime;
        try {
            startTime = TimestampParser.parseRfc3339(request.getStartTime());
            endTime = TimestampParser.parseRfc3339(request.getEndTime());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid time format, use RFC3339");
        }
        requireValidWindow(startTime, endTime);

        User patient = userService.findUser(caller.getUserId())
                .orElseThrow(() -> new NotFoundException("Could not find user details"));

        Appointment appointment = Appointment.builder()
                .patientId(patient.getId())
                .patientName(patient.getFullName())
                .startTime(startTime)
                .endTime(endTime)
                .service(request.getService())
                .status(AppointmentStatus.SCHEDULED)
                .build();

        appointment = appointmentRepository.save(appointment);
        log.info("Booked appointment {}: patient={} service={} start={}",
                appointment.getId(), patient.getId(), appointment.getService(), startTime);

        Appointment booked = appointment;
        afterCommit(() -> notificationService.sendAppointmentConfirmation(patient, booked));
        return appointment;
    }

    // =========================================================
    // LIST / GET
    // =========================================================

    /**
     * Filtered list. Clients only ever see their own appointments whatever patient
     * filter they send; dentists and staff may narrow the list to one patient.
     * Malformed dates and patient ids are ignored rather than rejected.
     */
    @Transactional(readOnly = true)
    public List<Appointment> listAppointments(SessionPrincipal caller, AppointmentFilter filter,
                                              AppointmentListOrder order) {
        accessPolicy.check(caller, Operation.LIST_APPOINTMENTS);

        AppointmentFilter f = filter != null ? filter : new AppointmentFilter();

        Long patientId = caller.getRole() == Role.CLIENT
                ? caller.getUserId()
                : parseIdOrOmit(f.getPatientId());

        Instant from = TimestampParser.parseDateOrOmit(f.getStartDate())
                .map(TimestampParser::startOfDay)
                .orElse(null);
        Instant until = TimestampParser.parseDateOrOmit(f.getEndDate())
                .map(TimestampParser::endOfDay)
                .orElse(null);
        String status = f.getStatus() == null || f.getStatus().isEmpty() ? null : f.getStatus();

        return appointmentRepository.findAll(
                AppointmentSpecifications.matching(patientId, from, until, status),
                order.toSort());
    }

    @Transactional(readOnly = true)
    public Appointment getAppointment(SessionPrincipal caller, Long appointmentId) {
        accessPolicy.check(caller, Operation.VIEW_APPOINTMENT);

        Appointment appointment = findOrThrow(appointmentId);
        // other patients' appointments look missing to a client
        if (caller.getRole() == Role.CLIENT && !caller.getUserId().equals(appointment.getPatientId())) {
            throw new NotFoundException("Appointment not found");
        }
        return appointment;
    }

    // =========================================================
    // UPDATE
    // =========================================================

    /**
     * Applies the supplied fields only. Timestamps that do not parse are dropped
     * from the update instead of failing it; an update left with nothing to apply
     * is rejected.
     */
    @Transactional
    public Appointment updateAppointment(SessionPrincipal caller, Long appointmentId,
                                         UpdateAppointmentRequest request) {
        accessPolicy.check(caller, Operation.MODIFY_APPOINTMENT);

        UpdateAppointmentRequest r = request != null ? request : new UpdateAppointmentRequest();
        Optional<Instant> startTime = TimestampParser.parseOrOmit(r.getStartTime());
        Optional<Instant> endTime = TimestampParser.parseOrOmit(r.getEndTime());
        Optional<String> service = Optional.ofNullable(r.getService());
        Optional<String> status = Optional.ofNullable(r.getStatus());

        if (startTime.isEmpty() && endTime.isEmpty() && service.isEmpty() && status.isEmpty()) {
            throw new ValidationException("No fields to update");
        }

        Appointment appointment = findOrThrow(appointmentId);

        if (startTime.isPresent() || endTime.isPresent()) {
            requireValidWindow(startTime.orElse(appointment.getStartTime()),
                    endTime.orElse(appointment.getEndTime()));
        }

        startTime.ifPresent(appointment::setStartTime);
        endTime.ifPresent(appointment::setEndTime);
        service.ifPresent(appointment::setService);
        status.ifPresent(appointment::setStatus);

        appointment = appointmentRepository.save(appointment);
        log.info("Appointment {} updated by user {} ({})", appointmentId, caller.getUserId(),
                caller.getRole().getValue());
        return appointment;
    }

    // =========================================================
    // CANCEL
    // =========================================================

    /**
     * Marks the appointment cancelled; the record is kept. The patient is told by SMS
     * after commit if their profile can still be found.
     */
    @Transactional
    public Appointment cancelAppointment(SessionPrincipal caller, Long appointmentId) {
        accessPolicy.check(caller, Operation.CANCEL_APPOINTMENT);

        Appointment appointment = findOrThrow(appointmentId);
        if (AppointmentStatus.CANCELLED.equals(appointment.getStatus())) {
            log.info("Appointment {} already cancelled", appointmentId);
            return appointment;
        }

        appointment.setStatus(AppointmentStatus.CANCELLED);
        appointment = appointmentRepository.save(appointment);
        log.info("Cancelled appointment {} by user {}", appointmentId, caller.getUserId());

        Optional<User> patient = userService.findUser(appointment.getPatientId());
        if (patient.isPresent()) {
            Appointment cancelled = appointment;
            afterCommit(() -> notificationService.sendAppointmentCancellation(patient.get(), cancelled));
        } else {
            log.warn("Patient {} of appointment {} not found, cancellation SMS skipped",
                    appointment.getPatientId(), appointmentId);
        }
        return appointment;
    }

    /**
     * Runs the action once the surrounding transaction has committed, so a rolled back
     * booking or cancellation never reaches the patient. Without a transaction it runs
     * immediately.
     */
    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private Appointment findOrThrow(Long appointmentId) {
        if (appointmentId == null) {
            throw new ValidationException("Invalid appointment ID");
        }
        return appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new NotFoundException("Appointment not found"));
    }

    private static void requireValidWindow(Instant startTime, Instant endTime) {
        if (startTime != null && endTime != null && !startTime.isBefore(endTime)) {
            throw new ValidationException("startTime must be before endTime");
        }
    }

    private static Long parseIdOrOmit(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
