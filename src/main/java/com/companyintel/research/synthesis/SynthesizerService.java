package com.companyintel.research.synthesis;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.api.RenderingPolicy;
import com.companyintel.research.model.AggregateState;
import com.companyintel.research.model.Report;
import com.companyintel.research.model.ResearchRequest;
import com.companyintel.research.model.WorkerResult;
import com.companyintel.research.model.WorkerStatus;
import com.companyintel.thread.MdcCallables;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.companyintel.research.ResearchConstants.NOTES_HEADING;
import static com.companyintel.research.ResearchConstants.RENDERING_FAILED_NOTE;
import static com.companyintel.research.ResearchConstants.REPORT_BRIEF;
import static com.companyintel.research.ResearchConstants.REPORT_TITLE;
import static com.companyintel.research.ResearchConstants.TOTAL_FAILURE_MESSAGE;

/**
 * Builds the final {@link Report} from a fully populated aggregate.
 * <p>
 * Every failed or partially completed domain gets a note. When all domains failed a minimal report is
 * returned instead of raising. Rendering runs on the worker executor under its own timeout; a renderer
 * that fails or takes too long is replaced by the markdown layout.
 */
@Service
@Slf4j
public class SynthesizerService {

    private final RenderingPolicy renderingPolicy;
    private final MarkdownRenderingPolicy fallbackPolicy = new MarkdownRenderingPolicy();
    private final Clock clock;
    private final Duration renderTimeout;
    private final ExecutorService renderExecutor;

    public SynthesizerService(RenderingPolicy renderingPolicy,
                              Clock clock,
                              ResearchProperties properties,
                              @Qualifier("researchWorkerExecutor") ExecutorService renderExecutor) {
        this.renderingPolicy = renderingPolicy;
        this.clock = clock;
        this.renderTimeout = properties.getSynthesis().getRenderTimeout();
        this.renderExecutor = renderExecutor;
    }

    public Report synthesize(AggregateState aggregate, ResearchRequest request) {
        String text = aggregate.allFailed()
                ? renderTotalFailure(aggregate, request)
                : renderBody(aggregate, request) + notes(aggregate);
        log.info("Synthesized report for '{}' ({} chars, allFailed={}).", request.subject(), text.length(),
                aggregate.allFailed());
        return new Report(text.trim(), request, aggregate.domainSummaries(), clock.instant());
    }

    private String renderBody(AggregateState aggregate, ResearchRequest request) {
        Future<String> rendering = renderExecutor.submit(
                MdcCallables.wrap(() -> renderingPolicy.render(aggregate, request)));
        try {
            return rendering.get(renderTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            rendering.cancel(true);
            return fallback(aggregate, request, "timed out after " + renderTimeout.toMillis() + " ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            return fallback(aggregate, request, cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            rendering.cancel(true);
            return fallback(aggregate, request, "interrupted");
        }
    }

    private String fallback(AggregateState aggregate, ResearchRequest request, String reason) {
        log.warn("Report rendering failed, falling back to markdown: {}", reason);
        return fallbackPolicy.render(aggregate, request) + "\n\n" + RENDERING_FAILED_NOTE.formatted(reason);
    }

    private String renderTotalFailure(AggregateState aggregate, ResearchRequest request) {
        log.warn("All {} research domains failed for '{}'.", aggregate.size(), request.subject());
        return REPORT_TITLE.formatted(request.subject()) + "\n\n"
                + REPORT_BRIEF.formatted(request.researchBrief()) + "\n\n"
                + TOTAL_FAILURE_MESSAGE
                + notes(aggregate);
    }

    private String notes(AggregateState aggregate) {
        StringBuilder sb = new StringBuilder();
        for (WorkerResult result : aggregate.results().values()) {
            if (result.status() == WorkerStatus.COMPLETED) {
                continue;
            }
            sb.append("- **").append(result.domain().heading()).append("**: ")
                    .append(result.status().label());
            if (result.error() != null) {
                sb.append(" (").append(result.error().describe()).append(")");
            }
            sb.append("; ").append(result.findings().size()).append(" finding(s) collected.\n");
        }
        if (sb.length() == 0) {
            return "";
        }
        return "\n\n" + NOTES_HEADING + "\n" + sb;
    }
}
