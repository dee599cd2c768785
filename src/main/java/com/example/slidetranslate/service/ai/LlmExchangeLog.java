package com.example.slidetranslate.service.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;

/**
 * Appends every backend request and response to a plain-text file when
 * {@code --debug-llm} is given.
 */
@Component
public class LlmExchangeLog {

    private static final Logger logger = LoggerFactory.getLogger(LlmExchangeLog.class);

    @Value("${ai.debug-log.enabled:false}")
    private boolean enabled;

    @Value("${ai.debug-log.path:llm_debug.log}")
    private String path;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public synchronized void record(String backendName, String systemPrompt, String userContent, String response) {
        if (!enabled) {
            return;
        }

        StringBuilder entry = new StringBuilder();
        entry.append("=== REQUEST ").append(LocalDateTime.now()).append(" (").append(backendName).append(") ===\n");
        entry.append("--- system ---\n").append(systemPrompt).append('\n');
        entry.append("--- user ---\n").append(userContent).append('\n');
        entry.append("=== RESPONSE ").append(LocalDateTime.now()).append(" ===\n");
        entry.append(response == null ? "<no response>" : response).append("\n\n");

        Path file = Paths.get(path);
        try {
            Files.write(file, entry.toString().getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            logger.warn("⚠️ Cannot write LLM debug log {}: {}", file, e.getMessage());
        }
    }
}
