package com.companyintel.research.planning;

import com.companyintel.research.api.PlanningAdvisor;
import com.companyintel.research.model.JobAnalysis;
import com.companyintel.research.model.PlanningAdvice;
import com.companyintel.research.model.ResearchRequest;
import com.companyintel.research.service.JsonProcessingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.lang.Nullable;

import java.util.Optional;

import static com.companyintel.research.ResearchConstants.PLANNING_SYSTEM_PROMPT;
import static com.companyintel.research.ResearchConstants.PLANNING_USER_TEMPLATE;

/**
 * Lets the chat model plan objectives and a focus per domain from the company and role context.
 */
@Slf4j
public class ChatPlanningAdvisor implements PlanningAdvisor {

    private static final String PURPOSE = "research-plan";

    private final ChatClient chatClient;
    private final JsonProcessingService jsonProcessingService;

    public ChatPlanningAdvisor(ChatClient chatClient, JsonProcessingService jsonProcessingService) {
        this.chatClient = chatClient;
        this.jsonProcessingService = jsonProcessingService;
    }

    @Override
    public Optional<PlanningAdvice> advise(ResearchRequest request, @Nullable JobAnalysis analysis) {
        try {
            String raw = chatClient.prompt()
                    .system(PLANNING_SYSTEM_PROMPT)
                    .user(PLANNING_USER_TEMPLATE.formatted(planningContext(request, analysis)))
                    .call()
                    .content();
            return jsonProcessingService.readModelObject(PURPOSE, raw, PlanningAdvice.class, PlanningAdvice::hasAnyFocus);
        } catch (RuntimeException ex) {
            log.warn("Research planning failed for '{}', keeping the default focus: {}", request.subject(),
                    ex.toString());
            return Optional.empty();
        }
    }

    static String planningContext(ResearchRequest request, @Nullable JobAnalysis analysis) {
        StringBuilder context = new StringBuilder("Company: ").append(request.subject());
        if (request.jobTitle() == null) {
            return context.toString();
        }
        context.append("\nJob Title: ").append(request.jobTitle());
        if (analysis != null) {
            if (analysis.department() != null) {
                context.append("\nDepartment: ").append(analysis.department());
            }
            if (analysis.seniorityLevel() != null) {
                context.append("\nSeniority Level: ").append(analysis.seniorityLevel());
            }
            if (!analysis.companyValuesMentioned().isEmpty()) {
                context.append("\nCompany Values Mentioned: ").append(String.join(", ", analysis.companyValuesMentioned()));
            }
        }
        return context.toString();
    }
}
