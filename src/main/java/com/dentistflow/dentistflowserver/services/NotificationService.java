package com.dentistflow.dentistflowserver.services;

import com.dentistflow.dentistflowserver.entity.Appointment;
import com.dentistflow.dentistflowserver.entity.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Patient SMS about booked and cancelled appointments.
 * <p>
 * Fire-and-forget: messages are handed to the notification executor and this class
 * returns immediately. Every failure (no phone, full queue, provider error) ends in a
 * log line, never in an exception for the caller, and is not retried.
 */
@Service
@Slf4j
public class NotificationService {

    private static final DateTimeFormatter SMS_TIME_FORMAT =
            DateTimeFormatter.ofPattern("MMM d 'at' h:mm a", Locale.ENGLISH);

    private final SmsSender smsSender;
    private final TaskExecutor executor;
    private final ZoneId zone;

    @Autowired
    public NotificationService(SmsSender smsSender,
                               @Qualifier("notificationExecutor") TaskExecutor executor,
                               @Value("${dentistflow.sms.time-zone:UTC}") String zone) {
        this.smsSender = smsSender;
        this.executor = executor;
        this.zone = ZoneId.of(zone);
    }

    public void sendAppointmentConfirmation(User patient, Appointment appointment) {
        dispatch(patient, confirmationText(patient, appointment));
    }

    public void sendAppointmentCancellation(User patient, Appointment appointment) {
        dispatch(patient, cancellationText(patient, appointment));
    }

    String confirmationText(User patient, Appointment appointment) {
        return String.format("Appointment Confirmed: %s with %s on %s.",
                appointment.getService(), patient.getFullName(), formatStart(appointment));
    }

    String cancellationText(User patient, Appointment appointment) {
        return String.format("Appointment Cancelled: %s with %s on %s.",
                appointment.getService(), patient.getFullName(), formatStart(appointment));
    }

    private String formatStart(Appointment appointment) {
        return appointment.getStartTime() == null ? "an unknown date"
                : SMS_TIME_FORMAT.format(appointment.getStartTime().atZone(zone));
    }

    private void dispatch(User patient, String text) {
        String phone = patient.getPhone();
        if (phone == null || phone.isBlank()) {
            log.info("SMS not sent: patient {} has no phone number.", patient.getId());
            return;
        }
        try {
            executor.execute(() -> deliver(phone, text));
        } catch (TaskRejectedException e) {
            log.warn("SMS to {} dropped, notification queue is full", phone);
        }
    }

    private void deliver(String phone, String text) {
        try {
            smsSender.send(phone, text);
        } catch (Exception e) {
            log.error("Failed to send SMS to {}", phone, e);
        }
    }
}
