package com.companyintel.research.worker;

import com.companyintel.research.api.DecisionPolicy;
import com.companyintel.research.model.ErrorKind;
import com.companyintel.research.model.Finding;
import com.companyintel.research.model.Instruction;
import com.companyintel.research.model.ResearchDomain;
import com.companyintel.research.model.WorkerError;
import com.companyintel.research.model.WorkerResult;
import com.companyintel.research.model.WorkerSpec;
import com.companyintel.research.model.WorkerStatus;
import com.companyintel.research.task.IterationBudget;
import com.companyintel.research.task.TaskOutcome;
import com.companyintel.research.task.TaskUnit;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs the bounded research loop for one domain.
 * <p>
 * The worker moves from {@code IDLE} to {@code ITERATING} on launch and ends in exactly one of the
 * terminal states. Each iteration asks the {@link DecisionPolicy} for an instruction, runs one
 * {@link TaskUnit}, then either appends the finding and checks sufficiency or counts the failure.
 * Fatal failures stop the loop at once. The iteration budget is a hard cap on task units; running out
 * of it is not an error.
 * <p>
 * {@link #call()} never throws. Cancellation is observed at task unit boundaries, through the
 * thread's interrupt flag or a slot the supervisor already froze.
 */
@Slf4j
public class ResearchWorker implements Callable<WorkerResult> {

    private final WorkerSpec spec;
    private final TaskUnit taskUnit;
    @Nullable
    private final DecisionPolicy decisionPolicy;
    private final boolean partialOnFailures;
    private final WorkerResultSlot slot;
    private final IterationBudget budget;
    private volatile WorkerState state = WorkerState.IDLE;

    public ResearchWorker(WorkerSpec spec, TaskUnit taskUnit, @Nullable DecisionPolicy decisionPolicy,
                          boolean partialOnFailures) {
        this.spec = spec;
        this.taskUnit = taskUnit;
        this.decisionPolicy = decisionPolicy;
        this.partialOnFailures = partialOnFailures;
        this.slot = new WorkerResultSlot(spec.domain());
        this.budget = new IterationBudget(spec.iterationBudget());
    }

    @Override
    public WorkerResult call() {
        MDC.put("domain", spec.domain().key());
        try {
            return iterate();
        } finally {
            MDC.remove("domain");
        }
    }

    /**
     * Called by the supervisor when the deadline passes. Keeps the worker's own result if it already
     * reached a terminal state, otherwise freezes a deadline placeholder with the findings so far.
     */
    public WorkerResult expire(Duration deadline) {
        WorkerResult result = slot.expire(deadline);
        state = WorkerState.of(result.status());
        return result;
    }

    public WorkerResult crash(Throwable cause) {
        WorkerResult result = slot.crash(cause);
        state = WorkerState.of(result.status());
        return result;
    }

    public ResearchDomain domain() {
        return spec.domain();
    }

    public WorkerState state() {
        return state;
    }

    WorkerResultSlot slot() {
        return slot;
    }

    private WorkerResult iterate() {
        state = WorkerState.ITERATING;
        log.info("Worker {} started (budget={}).", spec.domain(), budget.limit());
        if (decisionPolicy == null) {
            return finish(WorkerStatus.FAILED, WorkerError.of(ErrorKind.MISCONFIGURED,
                    "No decision policy registered for domain " + spec.domain().key() + "."));
        }
        WorkerError lastError = null;
        boolean sufficient = false;
        try {
            while (!budget.exhausted()) {
                if (Thread.currentThread().isInterrupted() || slot.isFrozen()) {
                    return cancelled();
                }
                Instruction instruction = decisionPolicy.nextInstruction(slot.snapshot(), spec, budget.used() + 1);
                log.debug("Worker {} iteration {}: {}", spec.domain(), instruction.iteration(), instruction.query());
                TaskOutcome outcome = taskUnit.execute(instruction, budget);
                if (!slot.recordInvocation()) {
                    return cancelled();
                }
                if (outcome.succeeded()) {
                    if (!slot.append(outcome.finding())) {
                        return cancelled();
                    }
                    if (decisionPolicy.isSufficient(slot.snapshot())) {
                        sufficient = true;
                        break;
                    }
                } else {
                    lastError = outcome.failure();
                    slot.recordFailure();
                    if (lastError.kind().isFatal()) {
                        log.warn("Worker {} hit fatal error {}; not retrying.", spec.domain(), lastError.kind());
                        return finish(WorkerStatus.FAILED, lastError);
                    }
                }
            }
        } catch (RuntimeException ex) {
            log.error("Worker {} crashed after {} task units.", spec.domain(), budget.used(), ex);
            return crash(ex);
        }
        return resolve(sufficient, lastError);
    }

    private WorkerResult resolve(boolean sufficient, @Nullable WorkerError lastError) {
        List<Finding> findings = slot.snapshot();
        int failures = slot.failures();
        if (sufficient) {
            if (failures > 0 && partialOnFailures && lastError != null) {
                return finish(WorkerStatus.PARTIALLY_COMPLETED, failureSummary(lastError, failures));
            }
            return finish(WorkerStatus.COMPLETED, null);
        }
        if (!findings.isEmpty()) {
            WorkerError error = failures > 0 && lastError != null
                    ? failureSummary(lastError, failures)
                    : WorkerError.of(ErrorKind.BUDGET_EXHAUSTED, "Iteration budget of " + budget.limit()
                    + " exhausted before findings were judged sufficient.");
            return finish(WorkerStatus.PARTIALLY_COMPLETED, error);
        }
        if (lastError == null) {
            return finish(WorkerStatus.FAILED, WorkerError.of(ErrorKind.BUDGET_EXHAUSTED,
                    "No findings collected within " + budget.limit() + " task units."));
        }
        return finish(WorkerStatus.FAILED, WorkerError.of(lastError.kind(),
                "All " + budget.used() + " task units failed; last error: " + lastError.message()));
    }

    private WorkerError failureSummary(WorkerError lastError, int failures) {
        return WorkerError.of(lastError.kind(), failures + " of " + budget.used()
                + " task units failed; last error: " + lastError.message());
    }

    private WorkerResult cancelled() {
        log.info("Worker {} observed cancellation after {} task units.", spec.domain(), budget.used());
        return finish(WorkerStatus.FAILED, WorkerError.of(ErrorKind.DEADLINE_EXCEEDED,
                "Cancelled at a task unit boundary."));
    }

    private WorkerResult finish(WorkerStatus status, @Nullable WorkerError error) {
        WorkerResult result = slot.freeze(status, error);
        state = WorkerState.of(result.status());
        log.info("Worker {} finished: status={}, findings={}, invocations={}, failures={}.",
                spec.domain(), result.status(), result.findings().size(), result.invocations(), result.failures());
        return result;
    }
}
