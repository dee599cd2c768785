package com.example.slidetranslate.service.ai;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Deterministic stand-in for a real model, enabled with {@code --mock}. Answers every
 * {@code <id> ::: <limit> ::: <markup>} line with {@code <id> ::: [MOCK] <markup>}.
 */
@Component
public class MockChatClient implements ChatCompletionClient {

    public static final String MARKER = "[MOCK] ";

    @Value("${ai.mock:false}")
    private boolean enabled;

    @Override
    public String getName() {
        return "Mock translator";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public int getPriority() {
        return 0;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String complete(String systemPrompt, String userContent) {
        StringBuilder response = new StringBuilder();
        for (String line : userContent.split("\\R")) {
            String[] parts = line.split(BatchProtocol.DELIMITER, 3);
            if (parts.length < 3) {
                continue;
            }
            response.append(parts[0].trim())
                .append(' ').append(BatchProtocol.DELIMITER).append(' ')
                .append(MARKER).append(parts[2].trim())
                .append('\n');
        }
        return response.toString();
    }
}
