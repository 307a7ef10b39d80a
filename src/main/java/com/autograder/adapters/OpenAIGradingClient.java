package com.autograder.adapters;

import com.autograder.exceptions.GradingAdapterException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Grades answers through the OpenAI chat completions API
 */
public class OpenAIGradingClient implements GradingAdapter {
    private static final Logger logger = LoggerFactory.getLogger(OpenAIGradingClient.class);

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;

    public OpenAIGradingClient(String apiKey, String baseUrl, String model, Duration timeout) {
        this(apiKey, baseUrl, model, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(30))
                .readTimeout(timeout)
                .writeTimeout(Duration.ofSeconds(30))
                .callTimeout(timeout)
                .build());
    }

    OpenAIGradingClient(String apiKey, String baseUrl, String model, OkHttpClient httpClient) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public GradeEvaluation grade(GradingRequest request) throws GradingAdapterException {
        String prompt = buildGradingPrompt(request);
        String content;
        try {
            content = makeOpenAIRequest(prompt);
        } catch (IOException e) {
            throw new GradingAdapterException("OpenAI request failed for question "
                    + request.questionNumber() + ": " + e.getMessage(), e);
        }
        return parseEvaluationResponse(content, request);
    }

    /**
     * Build the grading prompt for one question
     */
    String buildGradingPrompt(GradingRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a strict but fair exam marker. Follow the marking scheme exactly; do not invent marks.\n");
        prompt.append("Only award marks clearly supported by evidence in the student's answer.\n");
        prompt.append("Return brief feedback (max 3 sentences).\n\n");
        prompt.append("QUESTION ").append(request.questionNumber()).append(": ")
              .append(request.questionText()).append("\n");
        prompt.append("MAXIMUM MARKS: ").append(request.maxMarks()).append("\n");

        if (request.markingScheme() != null && !request.markingScheme().isBlank()) {
            prompt.append("MARKING SCHEME:\n").append(request.markingScheme()).append("\n");
        }
        if (request.modelAnswer() != null && !request.modelAnswer().isBlank()) {
            prompt.append("MODEL ANSWER:\n").append(request.modelAnswer()).append("\n");
        }
        if (!request.keywords().isEmpty()) {
            prompt.append("EXPECTED KEYWORDS: ").append(String.join(", ", request.keywords())).append("\n");
        }

        prompt.append("\nSTUDENT ANSWER:\n");
        prompt.append(request.studentAnswer()).append("\n\n");

        prompt.append("Return your response in this JSON format (no extra text):\n");
        prompt.append("{\n");
        prompt.append("  \"marks\": <marks awarded, between 0 and ").append(request.maxMarks()).append(">,\n");
        prompt.append("  \"confidence\": <your confidence in the marks, between 0 and 1>,\n");
        prompt.append("  \"feedback\": \"<feedback for the student>\"\n");
        prompt.append("}\n");
        return prompt.toString();
    }

    /**
     * Make HTTP request to OpenAI API and return the first choice's content
     */
    private String makeOpenAIRequest(String prompt) throws IOException {
        String requestBody = objectMapper.writeValueAsString(Map.of(
            "model", model,
            "messages", List.of(Map.of("role", "user", "content", prompt)),
            "temperature", 0.0,
            "max_tokens", 800
        ));

        Request request = new Request.Builder()
                .url(baseUrl + "/chat/completions")
                .addHeader("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(requestBody, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("OpenAI API request failed: " + response.code() + " " + response.message());
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Empty response from OpenAI API");
            }
            JsonNode choices = objectMapper.readTree(body.string()).path("choices");
            if (choices.isArray() && choices.size() > 0) {
                return choices.get(0).path("message").path("content").asText("");
            }

            throw new IOException("Invalid response format from OpenAI API");
        }
    }

    /**
     * Parse the evaluation out of the model's reply, tolerating text around the JSON object
     */
    GradeEvaluation parseEvaluationResponse(String content, GradingRequest request) {
        int jsonStart = content.indexOf('{');
        int jsonEnd = content.lastIndexOf('}') + 1;
        if (jsonStart < 0 || jsonEnd <= jsonStart) {
            logger.warn("Could not find JSON in OpenAI response for question {}: {}", request.questionNumber(), content);
            throw new GradingAdapterException("Unparseable grading response for question " + request.questionNumber());
        }

        try {
            JsonNode evaluation = objectMapper.readTree(content.substring(jsonStart, jsonEnd));
            JsonNode marks = evaluation.path("marks");
            if (!marks.isNumber()) {
                throw new GradingAdapterException("Grading response has no numeric marks for question "
                        + request.questionNumber());
            }
            double confidence = evaluation.path("confidence").asDouble(0.5);
            String feedback = evaluation.path("feedback").asText("");
            return new GradeEvaluation(marks.asDouble(), Math.max(0.0, Math.min(1.0, confidence)), feedback);
        } catch (IOException e) {
            throw new GradingAdapterException("Malformed grading response for question "
                    + request.questionNumber() + ": " + e.getMessage(), e);
        }
    }
}
