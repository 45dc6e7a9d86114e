package com.companyintel.research.service;

import com.companyintel.research.model.AggregateState;
import com.companyintel.research.model.WorkerStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class ResearchMetricsService {

    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong workersLaunched = new AtomicLong();
    private final AtomicLong taskUnitsInvoked = new AtomicLong();
    private final AtomicLong deadlineCancellations = new AtomicLong();
    private final AtomicLong totalFailureRuns = new AtomicLong();
    private final Map<WorkerStatus, AtomicLong> statusCounts = new EnumMap<>(WorkerStatus.class);

    public ResearchMetricsService() {
        for (WorkerStatus status : WorkerStatus.values()) {
            statusCounts.put(status, new AtomicLong());
        }
    }

    public void recordRunStarted(String subject, int workerCount) {
        long runs = runCount.incrementAndGet();
        long launched = workersLaunched.addAndGet(workerCount);
        log.info("Research run #{} started for '{}' with {} workers. Total workers launched={}.",
                runs, subject, workerCount, launched);
    }

    public void recordDeadlineCancellation() {
        deadlineCancellations.incrementAndGet();
    }

    public void recordRunCompleted(AggregateState aggregate, Duration elapsed) {
        taskUnitsInvoked.addAndGet(aggregate.totalInvocations());
        aggregate.results().values().forEach(result -> statusCounts.get(result.status()).incrementAndGet());
        if (aggregate.allFailed()) {
            totalFailureRuns.incrementAndGet();
        }
        log.info("Research run finished in {} ms: statuses={}, taskUnits={}.",
                elapsed.toMillis(), aggregate.statusSummary(), aggregate.totalInvocations());
    }

    public long runCount() {
        return runCount.get();
    }

    public long taskUnitsInvoked() {
        return taskUnitsInvoked.get();
    }

    public long deadlineCancellations() {
        return deadlineCancellations.get();
    }

    public long statusCount(WorkerStatus status) {
        return statusCounts.get(status).get();
    }

    public void logSummary() {
        log.info("Research stats: runs={}, workersLaunched={}, taskUnits={}, completed={}, partial={}, failed={}, "
                        + "deadlineCancellations={}, totalFailureRuns={}.",
                runCount.get(), workersLaunched.get(), taskUnitsInvoked.get(),
                statusCount(WorkerStatus.COMPLETED), statusCount(WorkerStatus.PARTIALLY_COMPLETED),
                statusCount(WorkerStatus.FAILED), deadlineCancellations.get(), totalFailureRuns.get());
    }
}
