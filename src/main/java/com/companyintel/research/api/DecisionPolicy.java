package com.companyintel.research.api;

import com.companyintel.research.model.Finding;
import com.companyintel.research.model.Instruction;
import com.companyintel.research.model.ResearchDomain;
import com.companyintel.research.model.WorkerSpec;

import java.util.List;

/**
 * Per-domain strategy deciding what a worker asks next and when its findings are enough.
 * Invoked synchronously from the worker's own thread.
 */
public interface DecisionPolicy {

    /**
     * @return The domain this policy serves.
     */
    ResearchDomain domain();

    /**
     * Decides the next instruction from the findings accumulated so far.
     *
     * @param findings The findings collected by the worker, in invocation order.
     * @param spec The worker specification holding the request and the domain focus.
     * @param iteration The 1-based number of the task unit about to run.
     * @return The instruction for the next task unit.
     */
    Instruction nextInstruction(List<Finding> findings, WorkerSpec spec, int iteration);

    /**
     * Judges whether the collected findings are sufficient to stop iterating.
     *
     * @param findings The findings collected by the worker, in invocation order.
     * @return {@code true} to stop with a completed status.
     */
    boolean isSufficient(List<Finding> findings);
}
