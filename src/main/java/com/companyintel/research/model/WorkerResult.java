package com.companyintel.research.model;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Frozen outcome of one worker. Findings keep task unit invocation order.
 */
public record WorkerResult(
        ResearchDomain domain,
        List<Finding> findings,
        WorkerStatus status,
        @Nullable WorkerError error,
        int invocations,
        int failures
) {

    public WorkerResult {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(status, "status");
        findings = findings == null ? List.of() : List.copyOf(findings);
        if (status != WorkerStatus.COMPLETED && error == null) {
            throw new IllegalArgumentException("A " + status + " result requires an error descriptor.");
        }
    }

    public static WorkerResult timedOut(ResearchDomain domain, List<Finding> partialFindings,
                                        int invocations, int failures, Duration deadline) {
        return new WorkerResult(domain, partialFindings, WorkerStatus.FAILED,
                WorkerError.of(ErrorKind.DEADLINE_EXCEEDED,
                        "Cancelled after the " + deadline.toMillis() + " ms research deadline."),
                invocations, failures);
    }

    public static WorkerResult crashed(ResearchDomain domain, List<Finding> partialFindings,
                                       int invocations, int failures, Throwable cause) {
        String message = cause == null || cause.getMessage() == null
                ? "Worker terminated unexpectedly."
                : "Worker terminated unexpectedly: " + cause.getMessage();
        return new WorkerResult(domain, partialFindings, WorkerStatus.FAILED,
                WorkerError.of(ErrorKind.WORKER_CRASHED, message), invocations, failures);
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    public boolean failed() {
        return status == WorkerStatus.FAILED;
    }
}
