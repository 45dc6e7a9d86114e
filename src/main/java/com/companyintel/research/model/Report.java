package com.companyintel.research.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The final research report together with one completion summary per domain.
 */
public record Report(String text, ResearchRequest request, List<DomainSummary> summaries, Instant generatedAt) {

    public Report {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(generatedAt, "generatedAt");
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
    }

    public boolean complete() {
        return summaries.stream().allMatch(summary -> summary.status() == WorkerStatus.COMPLETED);
    }
}
