package com.dentistflow.dentistflowserver.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Sends SMS through the Textbelt HTTP API ({@code POST /text}).
 */
@Service
@Slf4j
public class TextbeltSmsSender implements SmsSender {

    private static final ParameterizedTypeReference<Map<String, Object>> REPLY_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestTemplate restTemplate;

    @Value("${dentistflow.sms.textbelt.url:https://textbelt.com/text}")
    private String textbeltUrl;

    @Value("${dentistflow.sms.textbelt.api-key:}")
    private String apiKey;

    public TextbeltSmsSender(@Qualifier("smsRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public void send(String phone, String message) {
        if (apiKey == null || apiKey.isEmpty()) {
            log.warn("Textbelt API key not set; skipping SMS to {}", phone);
            return;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, String> body = new HashMap<>();
        body.put("phone", phone);
        body.put("message", message);
        body.put("key", apiKey);

        ResponseEntity<Map<String, Object>> response;
        try {
            response = restTemplate.exchange(textbeltUrl, HttpMethod.POST, new HttpEntity<>(body, headers), REPLY_TYPE);
        } catch (RestClientException e) {
            throw new SmsDeliveryException("Textbelt request failed for " + phone, e);
        }

        Map<String, Object> reply = response.getBody();
        boolean success = reply != null && Boolean.TRUE.equals(reply.get("success"));
        if (!success) {
            Object reason = reply != null ? reply.get("error") : null;
            throw new SmsDeliveryException("Textbelt rejected SMS to " + phone + ". Reason: " + reason);
        }
        log.info("Successfully sent SMS via Textbelt to {}", phone);
    }
}
