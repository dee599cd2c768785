package com.example.slidetranslate.service.ai;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * OpenAI (or any server exposing the same chat-completions API).
 */
@Component
public class OpenAiChatClient extends OpenAiCompatibleChatClient {

    @Value("${ai.provider.openai.enabled:false}")
    private boolean enabled;

    @Value("${ai.provider.openai.api-url:https://api.openai.com/v1/chat/completions}")
    private String apiUrl;

    @Value("${ai.provider.openai.api-key:}")
    private String apiKey;

    @Value("${ai.provider.openai.model:gpt-4o}")
    private String model;

    @Value("${ai.provider.openai.priority:2}")
    private int priority;

    @Override
    public String getName() {
        return "OpenAI";
    }

    @Override
    public boolean isEnabled() {
        return enabled && hasText(apiUrl) && hasText(apiKey);
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    protected String endpointUrl() {
        return apiUrl;
    }

    @Override
    protected String authorizationHeaderName() {
        return HttpHeaders.AUTHORIZATION;
    }

    @Override
    protected String authorizationHeaderValue() {
        return "Bearer " + apiKey;
    }

    @Override
    protected void customizeRequest(Map<String, Object> requestBody) {
        requestBody.put("model", model);
    }
}
