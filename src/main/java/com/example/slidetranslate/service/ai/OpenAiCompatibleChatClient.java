package com.example.slidetranslate.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared request/response handling for backends speaking the chat-completions JSON
 * format. Subclasses supply the endpoint and the authentication header.
 */
public abstract class OpenAiCompatibleChatClient implements ChatCompletionClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiCompatibleChatClient.class);

    @Value("${ai.request-timeout-seconds:120}")
    protected long requestTimeoutSeconds;

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;

    protected OpenAiCompatibleChatClient() {
        this.webClient = WebClient.builder()
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
        this.objectMapper = new ObjectMapper();
    }

    protected abstract String endpointUrl();

    protected abstract String authorizationHeaderName();

    protected abstract String authorizationHeaderValue();

    /**
     * Hook for backend-specific request fields, such as the model name.
     */
    protected void customizeRequest(Map<String, Object> requestBody) {
    }

    @Override
    public String complete(String systemPrompt, String userContent) {
        if (!isEnabled()) {
            throw new TranslationBackendException(getName() + " is not enabled");
        }

        String requestJson;
        try {
            requestJson = objectMapper.writeValueAsString(buildRequest(systemPrompt, userContent));
        } catch (Exception e) {
            throw new TranslationBackendException("Cannot serialize request for " + getName(), e);
        }

        String response;
        try {
            response = webClient.post()
                .uri(endpointUrl())
                .header(authorizationHeaderName(), authorizationHeaderValue())
                .bodyValue(requestJson)
                .retrieve()
                .onStatus(HttpStatusCode::isError, clientResponse -> clientResponse.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(body -> Mono.error(toException(clientResponse.statusCode(), body))))
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(requestTimeoutSeconds))
                .block();
        } catch (TranslationBackendException e) {
            throw e;
        } catch (Exception e) {
            throw new TranslationBackendException(getName() + " request failed: " + e.getMessage(), e);
        }

        return parseResponse(response);
    }

    Map<String, Object> buildRequest(String systemPrompt, String userContent) {
        Map<String, Object> requestBody = new HashMap<>();
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(message("system", systemPrompt));
        messages.add(message("user", userContent));
        requestBody.put("messages", messages);
        requestBody.put("temperature", 0);
        customizeRequest(requestBody);
        return requestBody;
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> message = new HashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }

    String parseResponse(String response) {
        if (response == null || response.isEmpty()) {
            throw new TranslationBackendException(getName() + " returned an empty response");
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode choices = root.path("choices");
            if (choices.isArray() && choices.size() > 0) {
                JsonNode content = choices.get(0).path("message").path("content");
                if (content.isTextual()) {
                    return content.asText();
                }
            }
        } catch (Exception e) {
            throw new TranslationBackendException("Error parsing " + getName() + " response: " + e.getMessage(), e);
        }
        throw new TranslationBackendException(getName() + " response has no message content");
    }

    TranslationBackendException toException(HttpStatusCode status, String body) {
        String code = "";
        String message = body;
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            code = error.path("code").asText("");
            message = error.path("message").asText(body);
        } catch (Exception e) {
            logger.debug("{} error body is not JSON: {}", getName(), e.getMessage());
        }
        String description = getName() + " returned HTTP " + status.value() + ": " + message;
        if ("context_length_exceeded".equals(code) || message.contains("maximum context length")) {
            return new ContextLengthExceededException(description);
        }
        return new TranslationBackendException(description);
    }

    protected static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
