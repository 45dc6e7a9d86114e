package com.companyintel.api;

import java.time.Instant;

public record HealthResponse(String status, String service, String version, Instant timestamp) {
}
