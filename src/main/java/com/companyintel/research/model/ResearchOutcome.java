package com.companyintel.research.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a research run returns: the report and a domain to status summary for observability.
 */
public record ResearchOutcome(String runId, Report report, Map<ResearchDomain, WorkerStatus> statusSummary,
                              Duration elapsed) {

    public ResearchOutcome {
        statusSummary = Collections.unmodifiableMap(new LinkedHashMap<>(statusSummary));
    }
}
