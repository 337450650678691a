package com.pingpay.scheduler.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Liveness probe. Actuator's /actuator/health covers the database; this
 * one only says the process is serving requests.
 */
@RestController
public class HealthController {

    private final Clock clock;

    public HealthController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "timestamp", clock.instant().toString());
    }
}
