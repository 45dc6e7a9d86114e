package com.companyintel.research.planning;

import com.companyintel.research.model.JobAnalysis;
import com.companyintel.research.service.JsonProcessingService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.retry.TransientAiException;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ChatJobAnalyzerTest {

    private static final String DESCRIPTION = """
            Role: Backend Engineer
            Join our payments team. You will design APIs in Java and Kotlin.
            We value ownership and kindness.
            """;

    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final ChatJobAnalyzer analyzer = new ChatJobAnalyzer(chatClient,
            new JsonProcessingService(new ObjectMapper()), new JobContextExtractor());

    private void modelAnswers(String content) {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn(content);
    }

    @Test
    void readsStructuredAnalysis() {
        modelAnswers("""
                ```json
                {"jobTitle": "Senior Backend Engineer", "department": "Payments",
                 "keyResponsibilities": ["Design APIs"], "requiredSkills": ["Java", "Kotlin"],
                 "companyValuesMentioned": ["ownership", "kindness"], "seniorityLevel": "senior"}
                ```""");

        JobAnalysis analysis = analyzer.analyze(DESCRIPTION).orElseThrow();

        assertEquals("Senior Backend Engineer", analysis.jobTitle());
        assertEquals("Payments", analysis.department());
        assertEquals(List.of("Java", "Kotlin"), analysis.requiredSkills());
        assertEquals(List.of("ownership", "kindness"), analysis.companyValuesMentioned());
        assertEquals("senior", analysis.seniorityLevel());
    }

    @Test
    void missingListsBecomeEmpty() {
        modelAnswers("{\"jobTitle\": \"Backend Engineer\", \"department\": null}");

        JobAnalysis analysis = analyzer.analyze(DESCRIPTION).orElseThrow();

        assertTrue(analysis.keyResponsibilities().isEmpty());
        assertNull(analysis.department());
    }

    @Test
    void modelFailureFallsBackToTitleHeuristic() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenThrow(new TransientAiException("503 Service Unavailable"));

        assertEquals(Optional.of(JobAnalysis.titleOnly("Backend Engineer")), analyzer.analyze(DESCRIPTION));
    }

    @Test
    void answerWithoutTitleFallsBackToTitleHeuristic() {
        modelAnswers("{\"department\": \"Payments\"}");

        assertEquals("Backend Engineer", analyzer.analyze(DESCRIPTION).orElseThrow().jobTitle());
    }

    @Test
    void blankDescriptionIsNotSent() {
        ChatClient untouched = mock(ChatClient.class);
        ChatJobAnalyzer quiet = new ChatJobAnalyzer(untouched, new JsonProcessingService(new ObjectMapper()),
                new JobContextExtractor());

        assertTrue(quiet.analyze("  ").isEmpty());
        verifyNoInteractions(untouched);
    }
}
