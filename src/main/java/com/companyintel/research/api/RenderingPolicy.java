package com.companyintel.research.api;

import com.companyintel.research.model.AggregateState;
import com.companyintel.research.model.ResearchRequest;

/**
 * Turns the aggregated findings into report text.
 */
public interface RenderingPolicy {

    /**
     * Renders the body of the report. Notes about failed or partial domains are added by the synthesizer.
     *
     * @param aggregate The fully populated aggregate, in launch order.
     * @param request The request being answered.
     * @return The rendered report text.
     */
    String render(AggregateState aggregate, ResearchRequest request);
}
