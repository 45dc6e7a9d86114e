package com.companyintel.research.api;

import com.companyintel.research.exception.ToolException;
import com.companyintel.research.model.Instruction;
import com.companyintel.research.model.ToolResponse;

/**
 * External capability invoked by a task unit, such as a web search API or a model with search access.
 */
public interface ToolProvider {

    /**
     * Short identifier used in log lines.
     *
     * @return The provider name.
     */
    String name();

    /**
     * Performs one invocation. Implementations enforce their own timeout and must not retry.
     *
     * @param instruction The instruction issued by a worker.
     * @return The raw response; blank content is treated as a malformed response by the caller.
     * @throws ToolException If the provider failed in a way it can classify.
     */
    ToolResponse invoke(Instruction instruction) throws ToolException;
}
