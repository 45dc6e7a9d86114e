package com.companyintel.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/health")
public class HealthController {

    static final String SERVICE = "Company Research Assistant API";
    static final String VERSION = "1.0.0";

    @GetMapping
    public HealthResponse health() {
        return new HealthResponse("healthy", SERVICE, VERSION, Instant.now());
    }
}
