package com.companyintel.research.synthesis;

import com.companyintel.research.api.RenderingPolicy;
import com.companyintel.research.model.AggregateState;
import com.companyintel.research.model.Finding;
import com.companyintel.research.model.ResearchRequest;
import com.companyintel.research.model.WorkerResult;

import static com.companyintel.research.ResearchConstants.NO_FINDINGS_MESSAGE;
import static com.companyintel.research.ResearchConstants.REPORT_BRIEF;
import static com.companyintel.research.ResearchConstants.REPORT_ROLE_CONTEXT;
import static com.companyintel.research.ResearchConstants.REPORT_TITLE;

/**
 * Deterministic markdown rendering: one section per domain that produced findings, in launch order.
 */
public class MarkdownRenderingPolicy implements RenderingPolicy {

    @Override
    public String render(AggregateState aggregate, ResearchRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append(REPORT_TITLE.formatted(request.subject())).append("\n\n");
        sb.append(REPORT_BRIEF.formatted(request.researchBrief())).append("\n\n");
        if (request.jobTitle() != null) {
            sb.append(REPORT_ROLE_CONTEXT.formatted(request.jobTitle())).append("\n\n");
        }
        sb.append(renderFindings(aggregate));
        return sb.toString().trim();
    }

    String renderFindings(AggregateState aggregate) {
        StringBuilder sb = new StringBuilder();
        for (WorkerResult result : aggregate.results().values()) {
            if (!result.hasFindings()) {
                continue;
            }
            sb.append("## ").append(result.domain().heading()).append("\n");
            for (Finding finding : result.findings()) {
                sb.append("- ").append(finding.content());
                if (finding.hasSource()) {
                    sb.append(" ([source](").append(finding.source()).append("))");
                }
                sb.append("\n");
            }
            sb.append("\n");
        }
        if (sb.length() == 0) {
            return NO_FINDINGS_MESSAGE + "\n";
        }
        return sb.toString();
    }
}
