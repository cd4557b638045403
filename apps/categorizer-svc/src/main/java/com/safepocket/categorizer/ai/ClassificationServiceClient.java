package com.safepocket.categorizer.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.safepocket.categorizer.config.CategorizerProperties;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Sends a rendered prompt to the configured language model and returns its free-text answer.
 * One call per invocation; retrying is left to {@link AiCallExecutor}.
 */
public class ClassificationServiceClient {

    private static final Logger log = LoggerFactory.getLogger(ClassificationServiceClient.class);
    private static final int MAX_OUTPUT_TOKENS = 200;
    private static final int MAX_LOGGED_BODY = 400;

    private enum Provider { OPENAI, GEMINI }

    record Message(String role, String content) {}

    record OpenAiResponsesRequest(String model, List<Message> input, Integer max_output_tokens) {}

    private final Provider provider;
    private final String model;
    private final String endpoint;
    private final String apiKey;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public ClassificationServiceClient(CategorizerProperties.Ai ai, String apiKey, ObjectMapper objectMapper) {
        this.provider = "openai".equals(ai.provider()) ? Provider.OPENAI : Provider.GEMINI;
        this.model = ai.model();
        this.endpoint = ai.endpoint();
        this.apiKey = apiKey;
        this.objectMapper = objectMapper;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(ai.timeout());
        requestFactory.setReadTimeout(ai.timeout());
        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
        log.info("Classification client configured: provider={} model={} readTimeoutMs={}",
                provider, model, ai.timeout().toMillis());
    }

    /**
     * @return the model's answer, or an empty string when the response carried no text
     * @throws AiThrottledException on HTTP 429
     * @throws AiServiceException   on any other HTTP or transport failure
     */
    public String complete(String prompt) {
        JsonNode response = provider == Provider.GEMINI ? callGemini(prompt) : callOpenAi(prompt);
        if (response == null) {
            return "";
        }
        String text = provider == Provider.GEMINI ? extractGeminiText(response) : extractOpenAiText(response);
        return text == null ? "" : text;
    }

    private JsonNode callGemini(String prompt) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.putArray("contents").addObject().putArray("parts").addObject().put("text", prompt);
        ObjectNode generationConfig = payload.putObject("generationConfig");
        generationConfig.put("maxOutputTokens", MAX_OUTPUT_TOKENS);
        generationConfig.put("responseMimeType", "text/plain");
        return post(geminiEndpoint(), payload, true);
    }

    private JsonNode callOpenAi(String prompt) {
        OpenAiResponsesRequest body = new OpenAiResponsesRequest(
                model, List.of(new Message("user", prompt)), MAX_OUTPUT_TOKENS);
        return post(endpoint, body, false);
    }

    private JsonNode post(String uri, Object body, boolean gemini) {
        try {
            return restClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (gemini) {
                            headers.set("x-goog-api-key", apiKey);
                        } else {
                            headers.setBearerAuth(apiKey);
                        }
                    })
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            if (status == 429) {
                throw new AiThrottledException("Classification service returned 429");
            }
            String responseBody = ex.getResponseBodyAsString();
            log.warn("Classification call failed (status {}){}", status,
                    responseBody.isBlank() ? "" : "; body=" + truncate(responseBody));
            throw new AiServiceException(status, "Classification service returned HTTP " + status);
        } catch (RestClientException ex) {
            throw new AiServiceException("Classification call failed: " + ex.getMessage(), ex);
        }
    }

    private String geminiEndpoint() {
        String base = endpoint.endsWith("/") ? endpoint : endpoint + "/";
        return base + "models/" + model + ":generateContent";
    }

    private String extractGeminiText(JsonNode response) {
        JsonNode candidates = response.get("candidates");
        if (candidates != null && candidates.isArray()) {
            for (JsonNode candidate : candidates) {
                JsonNode parts = candidate.path("content").path("parts");
                StringBuilder text = new StringBuilder();
                for (JsonNode part : parts) {
                    JsonNode partText = part.get("text");
                    if (partText != null && partText.isTextual()) {
                        text.append(partText.asText());
                    }
                }
                if (text.length() > 0) {
                    return text.toString();
                }
            }
        }
        JsonNode block = response.path("promptFeedback").get("blockReason");
        if (block != null && block.isTextual()) {
            log.warn("Classification prompt blocked: blockReason={}", block.asText());
        }
        return null;
    }

    private String extractOpenAiText(JsonNode response) {
        JsonNode outputText = response.get("output_text");
        if (outputText != null && outputText.isTextual()) {
            return outputText.asText();
        }
        return extractText(response.get("output"));
    }

    private String extractText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String nested = extractText(item);
                if (nested != null && !nested.isBlank()) {
                    return nested;
                }
            }
            return null;
        }
        String content = extractText(node.get("content"));
        if (content != null && !content.isBlank()) {
            return content;
        }
        return extractText(node.get("text"));
    }

    private String truncate(String value) {
        return value.length() <= MAX_LOGGED_BODY ? value : value.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
