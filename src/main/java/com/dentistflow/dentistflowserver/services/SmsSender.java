package com.dentistflow.dentistflowserver.services;

/**
 * Outbound SMS gateway. Implementations block until the provider answers and throw
 * {@link SmsDeliveryException} when it does not accept the message.
 */
public interface SmsSender {

    void send(String phone, String message);
}
