package com.companyintel.research.tool;

import com.companyintel.research.api.ToolProvider;
import com.companyintel.research.exception.ToolException;
import com.companyintel.research.model.ErrorKind;
import com.companyintel.research.model.Instruction;
import com.companyintel.research.model.ToolResponse;
import com.companyintel.research.service.JsonProcessingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;

import static com.companyintel.research.ResearchConstants.RESEARCH_TOOL_SYSTEM_PROMPT;
import static com.companyintel.research.ResearchConstants.RESEARCH_TOOL_USER_TEMPLATE;

/**
 * Uses the chat model itself as the research tool. The model must answer with a small JSON object.
 */
@Slf4j
public class ChatModelToolProvider implements ToolProvider {

    private static final String PURPOSE = "research-tool";

    private final ChatClient chatClient;
    private final JsonProcessingService jsonProcessingService;
    private final Clock clock;

    public ChatModelToolProvider(ChatClient chatClient, JsonProcessingService jsonProcessingService, Clock clock) {
        this.chatClient = chatClient;
        this.jsonProcessingService = jsonProcessingService;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "chat-model";
    }

    @Override
    public ToolResponse invoke(Instruction instruction) throws ToolException {
        String systemPrompt = RESEARCH_TOOL_SYSTEM_PROMPT.formatted(LocalDate.now(clock));
        String userPrompt = RESEARCH_TOOL_USER_TEMPLATE.formatted(instruction.domain().heading(), instruction.query());
        log.debug("Chat model research for {} iteration {}: {}", instruction.domain(), instruction.iteration(),
                instruction.query());
        String raw;
        try {
            raw = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .call()
                    .content();
        } catch (NonTransientAiException ex) {
            throw new ToolException(classify(ex), "Chat model rejected the request: " + ex.getMessage(), ex);
        } catch (TransientAiException ex) {
            throw new ToolException(ErrorKind.TOOL_UNAVAILABLE, "Chat model unavailable: " + ex.getMessage(), ex);
        }
        ResearchAnswer answer = jsonProcessingService.readModelObject(PURPOSE, raw, ResearchAnswer.class,
                        candidate -> StringUtils.hasText(candidate.summary()))
                .orElseThrow(() -> new ToolException(ErrorKind.MALFORMED_RESPONSE,
                        "Chat model answer did not match the expected JSON."));
        String source = StringUtils.hasText(answer.source()) && !"null".equalsIgnoreCase(answer.source().trim())
                ? answer.source()
                : null;
        return new ToolResponse(answer.summary(), source);
    }

    private ErrorKind classify(NonTransientAiException ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("401") || message.contains("403") || message.contains("api key")
                || message.contains("unauthorized")) {
            return ErrorKind.UNAUTHORIZED;
        }
        return ErrorKind.TOOL_REJECTED;
    }
}
