package com.companyintel.research;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.exception.InvalidRequestException;
import com.companyintel.research.model.AggregateState;
import com.companyintel.research.model.ErrorKind;
import com.companyintel.research.model.Report;
import com.companyintel.research.model.ResearchOutcome;
import com.companyintel.research.model.ResearchPlan;
import com.companyintel.research.model.ResearchRequest;
import com.companyintel.research.model.WorkerResult;
import com.companyintel.research.model.WorkerSpec;
import com.companyintel.research.service.ResearchMetricsService;
import com.companyintel.research.synthesis.SynthesizerService;
import com.companyintel.research.worker.ResearchWorker;
import com.companyintel.research.worker.WorkerFactory;
import com.companyintel.thread.MdcCallables;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of a research run.
 * <p>
 * Plans one worker per configured domain, launches them all concurrently and joins them against a
 * single run deadline. Workers still running at the deadline are cancelled and recorded as failed
 * with whatever findings they had collected. Every launched worker contributes exactly one result to
 * the aggregate, which is then handed to the synthesizer. Nothing survives between runs.
 */
@Slf4j
@Service
public class SupervisorService {

    static final String RUN_ID_KEY = "runId";

    private final ResearchProperties properties;
    private final ResearchPlanner planner;
    private final WorkerFactory workerFactory;
    private final SynthesizerService synthesizerService;
    private final ResearchMetricsService metricsService;
    private final ExecutorService workerExecutor;

    public SupervisorService(ResearchProperties properties,
                             ResearchPlanner planner,
                             WorkerFactory workerFactory,
                             SynthesizerService synthesizerService,
                             ResearchMetricsService metricsService,
                             @Qualifier("researchWorkerExecutor") ExecutorService workerExecutor) {
        this.properties = properties;
        this.planner = planner;
        this.workerFactory = workerFactory;
        this.synthesizerService = synthesizerService;
        this.metricsService = metricsService;
        this.workerExecutor = workerExecutor;
    }

    public ResearchOutcome run(ResearchRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Research request is required.");
        }
        String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID_KEY, runId);
        long started = System.nanoTime();
        try {
            ResearchPlan plan = planner.plan(request);
            ResearchRequest resolved = plan.request();
            List<WorkerSpec> specs = plan.workers();
            metricsService.recordRunStarted(resolved.subject(), specs.size());
            log.info("Research run {} for '{}' launching {} workers. Objectives: {}", runId, resolved.subject(),
                    specs.size(), plan.objectives());
            if (!plan.jobConsiderations().isEmpty()) {
                log.debug("Job-specific considerations: {}", plan.jobConsiderations());
            }

            List<WorkerResult> results = launchAndJoin(specs);
            AggregateState aggregate = AggregateState.assemble(specs, results);
            if (aggregate.allFailed()) {
                log.warn("Every research domain failed for '{}'.", resolved.subject());
            }

            Report report = synthesizerService.synthesize(aggregate, resolved);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            metricsService.recordRunCompleted(aggregate, elapsed);
            metricsService.logSummary();
            return new ResearchOutcome(runId, report, aggregate.statusSummary(), elapsed);
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }

    private List<WorkerResult> launchAndJoin(List<WorkerSpec> specs) {
        Duration deadline = properties.getDeadline();
        long deadlineNanos = System.nanoTime() + deadline.toNanos();

        List<ResearchWorker> workers = new ArrayList<>(specs.size());
        List<Future<WorkerResult>> futures = new ArrayList<>(specs.size());
        for (WorkerSpec spec : specs) {
            ResearchWorker worker = workerFactory.create(spec);
            workers.add(worker);
            futures.add(workerExecutor.submit(MdcCallables.wrap(worker)));
        }

        List<WorkerResult> results = new ArrayList<>(specs.size());
        boolean interrupted = false;
        for (int i = 0; i < workers.size(); i++) {
            ResearchWorker worker = workers.get(i);
            Future<WorkerResult> future = futures.get(i);
            if (interrupted) {
                results.add(cancel(worker, future, deadline));
                continue;
            }
            try {
                long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
                results.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException | CancellationException ex) {
                log.warn("Worker {} did not finish within the {} ms deadline; cancelling.",
                        worker.domain(), deadline.toMillis());
                results.add(cancel(worker, future, deadline));
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                log.error("Worker {} crashed.", worker.domain(), cause);
                results.add(worker.crash(cause));
            } catch (InterruptedException ex) {
                log.warn("Research run interrupted while waiting for worker {}.", worker.domain());
                Thread.currentThread().interrupt();
                interrupted = true;
                results.add(cancel(worker, future, deadline));
            }
        }
        return results;
    }

    /**
     * Freezes the deadline placeholder before interrupting the worker, so nothing the worker does while
     * unwinding can replace it. A worker that froze its own result first keeps it.
     */
    private WorkerResult cancel(ResearchWorker worker, Future<WorkerResult> future, Duration deadline) {
        boolean finishedFirst = worker.state().isTerminal();
        WorkerResult result = worker.expire(deadline);
        future.cancel(true);
        if (finishedFirst) {
            log.info("Worker {} finished just before the deadline with status {}.", worker.domain(), result.status());
        } else if (result.error() != null && result.error().kind() == ErrorKind.DEADLINE_EXCEEDED) {
            metricsService.recordDeadlineCancellation();
        }
        return result;
    }
}
