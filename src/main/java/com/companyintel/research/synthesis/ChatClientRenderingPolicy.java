package com.companyintel.research.synthesis;

import com.companyintel.research.api.RenderingPolicy;
import com.companyintel.research.model.AggregateState;
import com.companyintel.research.model.Finding;
import com.companyintel.research.model.ResearchRequest;
import com.companyintel.research.model.WorkerResult;
import com.companyintel.research.service.JsonProcessingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.companyintel.research.ResearchConstants.REPORT_SYSTEM_PROMPT;
import static com.companyintel.research.ResearchConstants.REPORT_USER_TEMPLATE;

/**
 * Asks the chat model to write the report from the collected findings.
 */
@Slf4j
public class ChatClientRenderingPolicy implements RenderingPolicy {

    private final ChatClient chatClient;
    private final JsonProcessingService jsonProcessingService;
    private final Clock clock;

    public ChatClientRenderingPolicy(ChatClient chatClient, JsonProcessingService jsonProcessingService, Clock clock) {
        this.chatClient = chatClient;
        this.jsonProcessingService = jsonProcessingService;
        this.clock = clock;
    }

    @Override
    public String render(AggregateState aggregate, ResearchRequest request) {
        String findingsJson = jsonProcessingService.toJson(findingsByDomain(aggregate));
        String userPrompt = REPORT_USER_TEMPLATE.formatted(request.researchBrief(), LocalDate.now(clock), findingsJson);
        log.info("Requesting report rendering from the chat model ({} chars of findings).", findingsJson.length());
        String content = chatClient.prompt()
                .system(REPORT_SYSTEM_PROMPT)
                .user(userPrompt)
                .call()
                .content();
        if (!StringUtils.hasText(content)) {
            throw new IllegalStateException("Chat model returned an empty report.");
        }
        return content.trim();
    }

    private Map<String, List<Map<String, String>>> findingsByDomain(AggregateState aggregate) {
        Map<String, List<Map<String, String>>> byDomain = new LinkedHashMap<>();
        for (WorkerResult result : aggregate.results().values()) {
            if (!result.hasFindings()) {
                continue;
            }
            List<Map<String, String>> entries = new ArrayList<>();
            for (Finding finding : result.findings()) {
                Map<String, String> entry = new LinkedHashMap<>();
                entry.put("content", finding.content());
                if (finding.hasSource()) {
                    entry.put("source", finding.source());
                }
                entries.add(entry);
            }
            byDomain.put(result.domain().heading(), entries);
        }
        return byDomain;
    }
}
