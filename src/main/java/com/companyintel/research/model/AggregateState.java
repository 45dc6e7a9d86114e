package com.companyintel.research.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-domain map of terminal worker results, keyed in launch order.
 * <p>
 * Only {@link #assemble(List, List)} creates instances, and it refuses to build a partially populated
 * aggregate: every issued {@link WorkerSpec} must have exactly one result.
 */
public final class AggregateState {

    private final Map<ResearchDomain, WorkerResult> results;

    private AggregateState(Map<ResearchDomain, WorkerResult> results) {
        this.results = Collections.unmodifiableMap(results);
    }

    public static AggregateState assemble(List<WorkerSpec> specs, List<WorkerResult> results) {
        Map<ResearchDomain, WorkerResult> byDomain = new LinkedHashMap<>();
        for (WorkerResult result : results) {
            if (byDomain.put(result.domain(), result) != null) {
                throw new IllegalStateException("Duplicate result for domain " + result.domain());
            }
        }
        Map<ResearchDomain, WorkerResult> ordered = new LinkedHashMap<>();
        for (WorkerSpec spec : specs) {
            WorkerResult result = byDomain.remove(spec.domain());
            if (result == null) {
                throw new IllegalStateException("Missing result for domain " + spec.domain());
            }
            ordered.put(spec.domain(), result);
        }
        if (!byDomain.isEmpty()) {
            throw new IllegalStateException("Results for domains that were never launched: " + byDomain.keySet());
        }
        return new AggregateState(ordered);
    }

    public Map<ResearchDomain, WorkerResult> results() {
        return results;
    }

    public WorkerResult get(ResearchDomain domain) {
        return results.get(domain);
    }

    public int size() {
        return results.size();
    }

    public Map<ResearchDomain, WorkerStatus> statusSummary() {
        Map<ResearchDomain, WorkerStatus> summary = new LinkedHashMap<>();
        results.forEach((domain, result) -> summary.put(domain, result.status()));
        return summary;
    }

    public List<DomainSummary> domainSummaries() {
        List<DomainSummary> summaries = new ArrayList<>(results.size());
        for (WorkerResult result : results.values()) {
            summaries.add(DomainSummary.from(result));
        }
        return summaries;
    }

    public boolean allFailed() {
        return !results.isEmpty() && results.values().stream().allMatch(WorkerResult::failed);
    }

    public int totalInvocations() {
        return results.values().stream().mapToInt(WorkerResult::invocations).sum();
    }
}
