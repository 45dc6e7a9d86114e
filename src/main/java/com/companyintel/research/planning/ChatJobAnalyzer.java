package com.companyintel.research.planning;

import com.companyintel.research.api.JobAnalyzer;
import com.companyintel.research.model.JobAnalysis;
import com.companyintel.research.service.JsonProcessingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.util.StringUtils;

import java.util.Optional;

import static com.companyintel.research.ResearchConstants.JOB_ANALYSIS_SYSTEM_PROMPT;
import static com.companyintel.research.ResearchConstants.JOB_ANALYSIS_USER_TEMPLATE;

/**
 * Asks the chat model for a structured analysis of the job description. When the model fails or
 * answers without a job title, the title heuristic of {@link JobContextExtractor} is used instead.
 */
@Slf4j
public class ChatJobAnalyzer implements JobAnalyzer {

    private static final String PURPOSE = "job-analysis";

    private final ChatClient chatClient;
    private final JsonProcessingService jsonProcessingService;
    private final JobAnalyzer fallback;

    public ChatJobAnalyzer(ChatClient chatClient, JsonProcessingService jsonProcessingService, JobAnalyzer fallback) {
        this.chatClient = chatClient;
        this.jsonProcessingService = jsonProcessingService;
        this.fallback = fallback;
    }

    @Override
    public Optional<JobAnalysis> analyze(String jobDescription) {
        if (!StringUtils.hasText(jobDescription)) {
            return Optional.empty();
        }
        try {
            String raw = chatClient.prompt()
                    .system(JOB_ANALYSIS_SYSTEM_PROMPT)
                    .user(JOB_ANALYSIS_USER_TEMPLATE.formatted(jobDescription))
                    .call()
                    .content();
            Optional<JobAnalysis> analysis = jsonProcessingService.readModelObject(PURPOSE, raw, JobAnalysis.class,
                    candidate -> StringUtils.hasText(candidate.jobTitle()));
            if (analysis.isPresent()) {
                log.info("Job description analyzed: title='{}', seniority={}, {} skill(s).",
                        analysis.get().jobTitle(), analysis.get().seniorityLevel(), analysis.get().requiredSkills().size());
                return analysis;
            }
        } catch (RuntimeException ex) {
            log.warn("Job description analysis failed, using the title heuristic: {}", ex.toString());
            return fallback.analyze(jobDescription);
        }
        log.info("Job description analysis gave no title, using the title heuristic.");
        return fallback.analyze(jobDescription);
    }
}
