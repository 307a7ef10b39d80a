package com.autograder.adapters;

import com.autograder.exceptions.GradingAdapterException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class OpenAIGradingClientTest {

    private final OpenAIGradingClient client = new OpenAIGradingClient(
            "sk-test", "http://localhost:1", "gpt-4o-mini", Duration.ofSeconds(1));

    private final GradingRequest request = new GradingRequest(2, "Define osmosis.",
            "Movement of water across a semi-permeable membrane.", "2 marks for membrane", 4.0,
            Set.of("membrane"), "Water moves through a membrane.");

    @Test
    void testPromptContainsQuestionMaterial() {
        String prompt = client.buildGradingPrompt(request);

        assertTrue(prompt.contains("QUESTION 2: Define osmosis."));
        assertTrue(prompt.contains("MAXIMUM MARKS: 4.0"));
        assertTrue(prompt.contains("2 marks for membrane"));
        assertTrue(prompt.contains("EXPECTED KEYWORDS: membrane"));
        assertTrue(prompt.contains("Water moves through a membrane."));
    }

    @Test
    void testParsesJsonSurroundedByText() {
        String content = "Here is my evaluation:\n{\"marks\": 3.5, \"confidence\": 0.9, \"feedback\": \"Mostly right.\"}\nThanks";

        GradeEvaluation evaluation = client.parseEvaluationResponse(content, request);

        assertEquals(3.5, evaluation.marks());
        assertEquals(0.9, evaluation.confidence());
        assertEquals("Mostly right.", evaluation.feedback());
    }

    @Test
    void testConfidenceDefaultsAndIsClamped() {
        assertEquals(0.5, client.parseEvaluationResponse("{\"marks\": 1}", request).confidence());
        assertEquals(1.0, client.parseEvaluationResponse("{\"marks\": 1, \"confidence\": 7}", request).confidence());
    }

    @Test
    void testRejectsResponsesWithoutMarks() {
        assertThrows(GradingAdapterException.class,
                () -> client.parseEvaluationResponse("I cannot grade this.", request));
        assertThrows(GradingAdapterException.class,
                () -> client.parseEvaluationResponse("{\"marks\": \"many\"}", request));
        assertThrows(GradingAdapterException.class,
                () -> client.parseEvaluationResponse("{\"marks\": 2,,}", request));
    }

    @Test
    void testUnreachableServerIsAnAdapterFailure() {
        assertThrows(GradingAdapterException.class, () -> client.grade(request));
    }
}
