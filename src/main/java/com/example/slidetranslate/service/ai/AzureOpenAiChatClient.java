package com.example.slidetranslate.service.ai;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Azure OpenAI chat deployment.
 */
@Component
public class AzureOpenAiChatClient extends OpenAiCompatibleChatClient {

    @Value("${ai.provider.azure.enabled:false}")
    private boolean enabled;

    @Value("${ai.provider.azure.endpoint:}")
    private String endpoint;

    @Value("${ai.provider.azure.api-key:}")
    private String apiKey;

    @Value("${ai.provider.azure.api-version:2024-02-01}")
    private String apiVersion;

    @Value("${ai.provider.azure.deployment-name:}")
    private String deploymentName;

    @Value("${ai.provider.azure.priority:1}")
    private int priority;

    @Override
    public String getName() {
        return "Azure OpenAI";
    }

    @Override
    public boolean isEnabled() {
        return enabled && hasText(endpoint) && hasText(apiKey) && hasText(deploymentName);
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    protected String endpointUrl() {
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        return String.format("%s/openai/deployments/%s/chat/completions?api-version=%s",
            base, deploymentName, apiVersion);
    }

    @Override
    protected String authorizationHeaderName() {
        return "api-key";
    }

    @Override
    protected String authorizationHeaderValue() {
        return apiKey;
    }
}
