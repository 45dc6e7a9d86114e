package com.companyintel.research.task;

import com.companyintel.research.api.ToolProvider;
import com.companyintel.research.exception.ToolException;
import com.companyintel.research.model.ErrorKind;
import com.companyintel.research.model.Instruction;
import com.companyintel.research.model.ResearchDomain;
import com.companyintel.research.model.ToolResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskUnitTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private final ToolProvider toolProvider = mock(ToolProvider.class);
    private final TaskUnit taskUnit = new TaskUnit(toolProvider, Clock.fixed(NOW, ZoneOffset.UTC));
    private final Instruction instruction = new Instruction(ResearchDomain.PAST, "Acme history", 1);

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void successProducesFindingAndConsumesOneUnit() throws Exception {
        when(toolProvider.invoke(instruction)).thenReturn(new ToolResponse("Founded in 1999", "https://acme.example"));
        IterationBudget budget = new IterationBudget(2);

        TaskOutcome outcome = taskUnit.execute(instruction, budget);

        assertTrue(outcome.succeeded());
        assertEquals("Founded in 1999", outcome.finding().content());
        assertEquals("https://acme.example", outcome.finding().source());
        assertEquals(NOW, outcome.finding().collectedAt());
        assertEquals(1, budget.used());
    }

    @Test
    void toolExceptionKeepsItsKind() throws Exception {
        when(toolProvider.invoke(any())).thenThrow(new ToolException(ErrorKind.UNAUTHORIZED, "bad key"));
        IterationBudget budget = new IterationBudget(1);

        TaskOutcome outcome = taskUnit.execute(instruction, budget);

        assertFalse(outcome.succeeded());
        assertEquals(ErrorKind.UNAUTHORIZED, outcome.failure().kind());
        assertTrue(budget.exhausted());
    }

    @Test
    void blankContentIsMalformed() throws Exception {
        when(toolProvider.invoke(any())).thenReturn(new ToolResponse("  ", null));
        assertEquals(ErrorKind.MALFORMED_RESPONSE,
                taskUnit.execute(instruction, new IterationBudget(1)).failure().kind());

        when(toolProvider.invoke(any())).thenReturn(null);
        assertEquals(ErrorKind.MALFORMED_RESPONSE,
                taskUnit.execute(instruction, new IterationBudget(1)).failure().kind());
    }

    @Test
    void unexpectedRuntimeErrorIsUnavailable() throws Exception {
        when(toolProvider.invoke(any())).thenThrow(new IllegalStateException("boom"));
        TaskOutcome outcome = taskUnit.execute(instruction, new IterationBudget(1));
        assertEquals(ErrorKind.TOOL_UNAVAILABLE, outcome.failure().kind());
    }

    @Test
    void interruptedCallIsTimeoutEvenWhenProviderClearedTheFlag() throws Exception {
        when(toolProvider.invoke(any())).thenAnswer(invocation -> {
            throw new IllegalStateException("I/O aborted", new InterruptedException());
        });

        TaskOutcome outcome = taskUnit.execute(instruction, new IterationBudget(1));

        assertEquals(ErrorKind.TOOL_TIMEOUT, outcome.failure().kind());
        assertTrue(Thread.interrupted(), "interrupt flag should be restored for the worker loop");
    }

    @Test
    void interruptedIoInsideToolExceptionIsTimeout() throws Exception {
        when(toolProvider.invoke(any())).thenThrow(new ToolException(ErrorKind.TOOL_UNAVAILABLE, "aborted",
                new InterruptedIOException("read interrupted")));

        TaskOutcome outcome = taskUnit.execute(instruction, new IterationBudget(1));

        assertEquals(ErrorKind.TOOL_TIMEOUT, outcome.failure().kind());
        assertTrue(Thread.interrupted());
    }

    @Test
    void readTimeoutIsNotTreatedAsInterrupt() throws Exception {
        when(toolProvider.invoke(any())).thenThrow(new ToolException(ErrorKind.TOOL_UNAVAILABLE, "slow",
                new SocketTimeoutException("Read timed out")));

        TaskOutcome outcome = taskUnit.execute(instruction, new IterationBudget(1));

        assertEquals(ErrorKind.TOOL_UNAVAILABLE, outcome.failure().kind());
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    void runtimeErrorWhileInterruptedIsTimeout() throws Exception {
        when(toolProvider.invoke(any())).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("channel closed");
        });

        TaskOutcome outcome = taskUnit.execute(instruction, new IterationBudget(1));

        assertEquals(ErrorKind.TOOL_TIMEOUT, outcome.failure().kind());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void refusesToRunOnExhaustedBudget() throws Exception {
        IterationBudget budget = new IterationBudget(1);
        assertTrue(budget.tryConsume());

        assertThrows(IllegalStateException.class, () -> taskUnit.execute(instruction, budget));
        verify(toolProvider, never()).invoke(any());
    }

    @Test
    void budgetMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new IterationBudget(0));
    }
}
