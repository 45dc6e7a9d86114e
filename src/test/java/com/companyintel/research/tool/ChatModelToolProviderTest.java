package com.companyintel.research.tool;

import com.companyintel.research.exception.ToolException;
import com.companyintel.research.model.ErrorKind;
import com.companyintel.research.model.Instruction;
import com.companyintel.research.model.ResearchDomain;
import com.companyintel.research.model.ToolResponse;
import com.companyintel.research.service.JsonProcessingService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatModelToolProviderTest {

    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final ChatModelToolProvider provider = new ChatModelToolProvider(chatClient,
            new JsonProcessingService(new ObjectMapper()),
            Clock.fixed(Instant.parse("2025-05-01T00:00:00Z"), ZoneOffset.UTC));
    private final Instruction instruction = new Instruction(ResearchDomain.CULTURE, "Acme values", 1);

    private void modelAnswers(String content) {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn(content);
    }

    @Test
    void parsesJsonAnswerWrappedInProse() throws Exception {
        modelAnswers("Sure! ```json\n{\"summary\": \"Acme values ownership.\", \"source\": \"https://acme.example/values\"}\n```");

        ToolResponse response = provider.invoke(instruction);

        assertEquals("Acme values ownership.", response.content());
        assertEquals("https://acme.example/values", response.source());
    }

    @Test
    void literalNullSourceIsDropped() throws Exception {
        modelAnswers("{\"summary\": \"Acme is remote-first.\", \"source\": \"null\"}");

        assertNull(provider.invoke(instruction).source());
    }

    @Test
    void nonJsonAnswerIsMalformed() {
        modelAnswers("I could not find anything.");

        ToolException ex = assertThrows(ToolException.class, () -> provider.invoke(instruction));
        assertEquals(ErrorKind.MALFORMED_RESPONSE, ex.getKind());
    }

    @Test
    void transientFailureIsUnavailable() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenThrow(new TransientAiException("503 Service Unavailable"));

        ToolException ex = assertThrows(ToolException.class, () -> provider.invoke(instruction));
        assertEquals(ErrorKind.TOOL_UNAVAILABLE, ex.getKind());
    }

    @Test
    void authenticationFailureIsFatal() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenThrow(new NonTransientAiException("401 - Incorrect API key provided"));

        ToolException ex = assertThrows(ToolException.class, () -> provider.invoke(instruction));
        assertEquals(ErrorKind.UNAUTHORIZED, ex.getKind());
    }

    @Test
    void otherClientErrorsAreRejected() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenThrow(new NonTransientAiException("400 - context length exceeded"));

        ToolException ex = assertThrows(ToolException.class, () -> provider.invoke(instruction));
        assertEquals(ErrorKind.TOOL_REJECTED, ex.getKind());
    }
}
