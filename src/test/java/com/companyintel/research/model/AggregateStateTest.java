package com.companyintel.research.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AggregateStateTest {

    private final ResearchRequest request = ResearchRequest.of("Acme");

    private WorkerSpec spec(ResearchDomain domain) {
        return new WorkerSpec(domain, request, "focus", 3);
    }

    private WorkerResult completed(ResearchDomain domain) {
        return new WorkerResult(domain, List.of(new Finding(domain.key() + " fact", null, Instant.EPOCH)),
                WorkerStatus.COMPLETED, null, 2, 0);
    }

    private WorkerResult failed(ResearchDomain domain) {
        return new WorkerResult(domain, List.of(), WorkerStatus.FAILED,
                WorkerError.of(ErrorKind.TOOL_UNAVAILABLE, "down"), 3, 3);
    }

    @Test
    void keepsLaunchOrderRegardlessOfCompletionOrder() {
        List<WorkerSpec> specs = List.of(spec(ResearchDomain.PAST), spec(ResearchDomain.FUTURE),
                spec(ResearchDomain.CULTURE));
        AggregateState aggregate = AggregateState.assemble(specs, List.of(
                completed(ResearchDomain.CULTURE), failed(ResearchDomain.PAST), completed(ResearchDomain.FUTURE)));

        assertEquals(List.of(ResearchDomain.PAST, ResearchDomain.FUTURE, ResearchDomain.CULTURE),
                List.copyOf(aggregate.results().keySet()));
        assertEquals(Map.of(ResearchDomain.PAST, WorkerStatus.FAILED,
                ResearchDomain.FUTURE, WorkerStatus.COMPLETED,
                ResearchDomain.CULTURE, WorkerStatus.COMPLETED), aggregate.statusSummary());
        assertEquals(7, aggregate.totalInvocations());
        assertFalse(aggregate.allFailed());
    }

    @Test
    void refusesMissingResult() {
        List<WorkerSpec> specs = List.of(spec(ResearchDomain.PAST), spec(ResearchDomain.FUTURE));
        assertThrows(IllegalStateException.class,
                () -> AggregateState.assemble(specs, List.of(completed(ResearchDomain.PAST))));
    }

    @Test
    void refusesDuplicateResult() {
        List<WorkerSpec> specs = List.of(spec(ResearchDomain.PAST));
        assertThrows(IllegalStateException.class, () -> AggregateState.assemble(specs,
                List.of(completed(ResearchDomain.PAST), failed(ResearchDomain.PAST))));
    }

    @Test
    void refusesResultForUnlaunchedDomain() {
        List<WorkerSpec> specs = List.of(spec(ResearchDomain.PAST));
        assertThrows(IllegalStateException.class, () -> AggregateState.assemble(specs,
                List.of(completed(ResearchDomain.PAST), completed(ResearchDomain.CULTURE))));
    }

    @Test
    void detectsTotalFailure() {
        List<WorkerSpec> specs = List.of(spec(ResearchDomain.PAST), spec(ResearchDomain.CULTURE));
        AggregateState aggregate = AggregateState.assemble(specs,
                List.of(failed(ResearchDomain.PAST), failed(ResearchDomain.CULTURE)));
        assertTrue(aggregate.allFailed());
        assertEquals(2, aggregate.domainSummaries().size());
        assertEquals(0, aggregate.domainSummaries().get(0).findingCount());
    }
}
