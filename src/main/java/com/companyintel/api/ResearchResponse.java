package com.companyintel.api;

import com.companyintel.research.model.DomainSummary;
import com.companyintel.research.model.ResearchOutcome;
import com.companyintel.research.model.ResearchRequest;

import java.time.Instant;
import java.util.List;

public record ResearchResponse(
        boolean success,
        String requestId,
        String companyName,
        String jobTitle,
        boolean hasJobContext,
        String report,
        int reportLength,
        List<DomainStatusResponse> domains,
        double processingTimeSeconds,
        Instant timestamp
) {

    public record DomainStatusResponse(String domain, String status, int findings, int invocations, String error) {

        static DomainStatusResponse from(DomainSummary summary) {
            return new DomainStatusResponse(summary.domain().key(), summary.status().name(), summary.findingCount(),
                    summary.invocations(), summary.error() != null ? summary.error().describe() : null);
        }
    }

    public static ResearchResponse from(ResearchOutcome outcome) {
        ResearchRequest request = outcome.report().request();
        String report = outcome.report().text();
        double seconds = Math.round(outcome.elapsed().toMillis() / 10.0) / 100.0;
        return new ResearchResponse(true, outcome.runId(), request.subject(), request.jobTitle(),
                request.hasJobContext(), report, report.length(),
                outcome.report().summaries().stream().map(DomainStatusResponse::from).toList(),
                seconds, outcome.report().generatedAt());
    }
}
