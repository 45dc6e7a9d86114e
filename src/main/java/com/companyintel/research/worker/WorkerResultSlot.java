package com.companyintel.research.worker;

import com.companyintel.research.model.Finding;
import com.companyintel.research.model.ResearchDomain;
import com.companyintel.research.model.WorkerError;
import com.companyintel.research.model.WorkerResult;
import com.companyintel.research.model.WorkerStatus;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * The state slice owned by one worker. Written only by the worker thread until frozen; the supervisor
 * reads it once, through {@link #expire(Duration)}, when the worker misses the deadline.
 * <p>
 * After freezing every mutation is rejected, so a cancelled worker cannot alter the placeholder the
 * supervisor already took.
 */
public final class WorkerResultSlot {

    private final ResearchDomain domain;
    private final List<Finding> findings = new ArrayList<>();
    private int invocations;
    private int failures;
    @Nullable
    private WorkerResult frozen;

    public WorkerResultSlot(ResearchDomain domain) {
        this.domain = domain;
    }

    public ResearchDomain domain() {
        return domain;
    }

    synchronized boolean recordInvocation() {
        if (frozen != null) {
            return false;
        }
        invocations++;
        return true;
    }

    synchronized boolean append(Finding finding) {
        if (frozen != null) {
            return false;
        }
        findings.add(finding);
        return true;
    }

    synchronized boolean recordFailure() {
        if (frozen != null) {
            return false;
        }
        failures++;
        return true;
    }

    public synchronized List<Finding> snapshot() {
        return List.copyOf(findings);
    }

    public synchronized int invocations() {
        return invocations;
    }

    public synchronized int failures() {
        return failures;
    }

    public synchronized boolean isFrozen() {
        return frozen != null;
    }

    /**
     * Freezes the slot with a terminal status. If the slot is already frozen the existing result wins.
     */
    synchronized WorkerResult freeze(WorkerStatus status, @Nullable WorkerError error) {
        if (frozen == null) {
            frozen = new WorkerResult(domain, findings, status, error, invocations, failures);
        }
        return frozen;
    }

    /**
     * Forces a deadline placeholder unless the worker already reached a terminal state on its own.
     * Findings appended before the deadline are kept.
     */
    public synchronized WorkerResult expire(Duration deadline) {
        if (frozen == null) {
            frozen = WorkerResult.timedOut(domain, findings, invocations, failures, deadline);
        }
        return frozen;
    }

    /**
     * Forces a crash result unless the worker already reached a terminal state on its own.
     */
    public synchronized WorkerResult crash(Throwable cause) {
        if (frozen == null) {
            frozen = WorkerResult.crashed(domain, findings, invocations, failures, cause);
        }
        return frozen;
    }
}
