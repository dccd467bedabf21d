package com.example.tracking.controller;

import com.example.tracking.model.WebhookAck;
import com.example.tracking.service.webhook.WebhookService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Inbound carrier push endpoint and liveness check.
 *
 * The body is taken as a raw string so a malformed payload is still answered with
 * the same acknowledgement as a valid one.
 */
@RestController
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookService webhookService;

    @PostMapping("/webhook")
    public WebhookAck webhook(@RequestBody(required = false) String body) {
        return webhookService.handle(body);
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
