package com.companyintel.research.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final JsonProcessingService service = new JsonProcessingService(new ObjectMapper());

    record Answer(String summary, String source) {
    }

    @Test
    void extractsObjectFromSurroundingProse() {
        String raw = "Here is what I found: {\"summary\":\"Acme builds anvils.\", \"source\":\"https://acme.example\"} Hope it helps.";
        Answer answer = service.readModelObject("test", raw, Answer.class).orElseThrow();
        assertEquals("Acme builds anvils.", answer.summary());
        assertEquals("https://acme.example", answer.source());
    }

    @Test
    void readsInsideCodeFenceAndIgnoresTrailingObjects() {
        String raw = """
                ```json
                {"summary": "Founded in 1949 {as a forge}", "source": null}
                ```
                Also see {"summary": "unrelated"}""";

        Answer answer = service.readModelObject("test", raw, Answer.class).orElseThrow();

        assertEquals("Founded in 1949 {as a forge}", answer.summary());
        assertNull(answer.source());
    }

    @Test
    void firstObjectSkipsBracesInsideStrings() {
        assertEquals(Optional.of("{\"a\":\"}{\",\"b\":{\"c\":1}}"),
                JsonProcessingService.firstObject("x {\"a\":\"}{\",\"b\":{\"c\":1}} y }"));
        assertEquals(Optional.empty(), JsonProcessingService.firstObject("{ never closed"));
    }

    @Test
    void unknownFieldsAreIgnored() {
        Answer answer = service.readModelObject("test",
                "{\"summary\":\"Remote-first\",\"confidence\":0.9}", Answer.class).orElseThrow();
        assertEquals("Remote-first", answer.summary());
    }

    @Test
    void rejectedByUsabilityCheck() {
        assertTrue(service.readModelObject("test", "{\"summary\":\"  \"}", Answer.class,
                a -> StringUtils.hasText(a.summary())).isEmpty());
    }

    @Test
    void emptyOrInvalidInputYieldsEmpty() {
        assertTrue(service.readModelObject("test", "", Answer.class).isEmpty());
        assertTrue(service.readModelObject("test", null, Answer.class).isEmpty());
        assertTrue(service.readModelObject("test", "{invalid-json}", Answer.class).isEmpty());
        assertTrue(service.readModelObject("test", "no object here", Answer.class).isEmpty());
    }

    @Test
    void serializesCompactly() {
        String json = service.toJson(Map.of("summary", "Acme"));
        assertEquals("{\"summary\":\"Acme\"}", json);
    }
}
