package com.demo.lending.service.events;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Posts escrow events as JSON to {@code <baseUrl>/events}. A failed delivery is logged and
 * dropped; the escrow operation that raised the event has already committed.
 */
@Slf4j
public class WebhookEscrowEventSink implements EscrowEventSink {

    private final RestTemplate rest;
    private final String base;

    public WebhookEscrowEventSink(RestTemplate rest, String baseUrl) {
        this.rest = rest;
        this.base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public void notify(String escrowId, long id, EscrowEvent kind) {
        Map<String, Object> body = Map.of(
                "escrow", escrowId,
                "id", id,
                "kind", kind.name());
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        try {
            rest.postForEntity(base + "/events", new HttpEntity<>(body, h), Void.class);
        } catch (Exception ex) {
            log.warn("Event delivery failed ({} escrow={} id={}): {}", kind, escrowId, id, ex.toString());
        }
    }
}
