package com.sessiongate.gateway.http;

import com.sessiongate.observability.HealthCheck;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final HealthCheck healthCheck;

    public HealthController(HealthCheck healthCheck) {
        this.healthCheck = healthCheck;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return healthCheck.run();
    }
}
