package com.companyintel.research.model;

import org.springframework.lang.Nullable;

public record DomainSummary(
        ResearchDomain domain,
        WorkerStatus status,
        int findingCount,
        int invocations,
        @Nullable WorkerError error
) {

    public static DomainSummary from(WorkerResult result) {
        return new DomainSummary(result.domain(), result.status(), result.findings().size(),
                result.invocations(), result.error());
    }
}
