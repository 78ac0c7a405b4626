package dev.minibook.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/** Liveness probe for load balancers; actuator health covers the dependencies. */
@RestController
public class HealthController {
    private final String hostname;

    public HealthController(@Value("${minibook.hostname:localhost}") String hostname) {
        this.hostname = hostname;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "hostname", hostname);
    }
}
