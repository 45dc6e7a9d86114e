package com.companyintel.research.task;

import com.companyintel.research.api.ToolProvider;
import com.companyintel.research.exception.ToolException;
import com.companyintel.research.model.ErrorKind;
import com.companyintel.research.model.Finding;
import com.companyintel.research.model.Instruction;
import com.companyintel.research.model.ToolResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.time.Clock;

/**
 * One bounded call-and-respond exchange with the tool provider.
 * <p>
 * Each execution consumes exactly one unit of the caller's budget, whatever the outcome, and never
 * retries. Provider failures come back as typed {@link TaskOutcome} failures instead of exceptions.
 * <p>
 * A call cut short by cancellation is reported as {@link ErrorKind#TOOL_TIMEOUT} and leaves the
 * thread's interrupt flag set, even when the provider swallowed the flag on its way out.
 */
@Component
@Slf4j
public class TaskUnit {

    private final ToolProvider toolProvider;
    private final Clock clock;

    public TaskUnit(ToolProvider toolProvider, Clock clock) {
        this.toolProvider = toolProvider;
        this.clock = clock;
    }

    public TaskOutcome execute(Instruction instruction, IterationBudget budget) {
        if (!budget.tryConsume()) {
            throw new IllegalStateException("Iteration budget of " + budget.limit() + " already exhausted for "
                    + instruction.domain());
        }
        try {
            ToolResponse response = toolProvider.invoke(instruction);
            if (response == null || !StringUtils.hasText(response.content())) {
                log.warn("Tool {} returned no content for {} iteration {}.",
                        toolProvider.name(), instruction.domain(), instruction.iteration());
                return TaskOutcome.failure(ErrorKind.MALFORMED_RESPONSE, "Tool returned an empty response.");
            }
            return TaskOutcome.success(new Finding(response.content(), response.source(), clock.instant()));
        } catch (ToolException ex) {
            if (interrupted(ex)) {
                return interruptedOutcome(instruction, ex);
            }
            log.warn("Tool {} failed for {} iteration {}: {} ({}).", toolProvider.name(), instruction.domain(),
                    instruction.iteration(), ex.getKind(), ex.getMessage());
            return TaskOutcome.failure(ex.getKind(), ex.getMessage());
        } catch (RuntimeException ex) {
            if (interrupted(ex)) {
                return interruptedOutcome(instruction, ex);
            }
            log.warn("Tool {} raised an unexpected error for {} iteration {}: {}", toolProvider.name(),
                    instruction.domain(), instruction.iteration(), ex.toString());
            return TaskOutcome.failure(ErrorKind.TOOL_UNAVAILABLE, ex.getMessage());
        }
    }

    private TaskOutcome interruptedOutcome(Instruction instruction, Exception ex) {
        Thread.currentThread().interrupt();
        log.warn("Tool {} call interrupted for {} iteration {}.", toolProvider.name(),
                instruction.domain(), instruction.iteration());
        return TaskOutcome.failure(ErrorKind.TOOL_TIMEOUT, "Tool call interrupted: " + ex.getMessage());
    }

    static boolean interrupted(Throwable ex) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException || cause instanceof ClosedByInterruptException) {
                return true;
            }
            // SocketTimeoutException extends InterruptedIOException but is a plain read timeout
            if (cause instanceof InterruptedIOException && !(cause instanceof SocketTimeoutException)) {
                return true;
            }
        }
        return false;
    }
}
