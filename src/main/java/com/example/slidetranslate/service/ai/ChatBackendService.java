package com.example.slidetranslate.service.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Chat backend with automatic fallback.
 * Tries enabled backends in priority order until one answers; in mock mode only the
 * mock backend is used.
 */
@Service
public class ChatBackendService {

    private static final Logger logger = LoggerFactory.getLogger(ChatBackendService.class);

    @Autowired(required = false)
    private List<ChatCompletionClient> clients;

    @Autowired
    private MockChatClient mockClient;

    @Autowired
    private RateLimiterService rateLimiter;

    @Autowired
    private LlmExchangeLog exchangeLog;

    @Value("${ai.mock:false}")
    private boolean mock;

    private List<ChatCompletionClient> sortedClients = new ArrayList<>();

    @PostConstruct
    public void initialize() {
        sortedClients = new ArrayList<>();
        if (clients != null) {
            for (ChatCompletionClient client : clients) {
                if (!(client instanceof MockChatClient)) {
                    sortedClients.add(client);
                }
            }
        }
        sortedClients.sort(Comparator.comparingInt(ChatCompletionClient::getPriority));

        if (mock) {
            logger.info("🤖 Mock translation backend active, no requests leave this machine");
            return;
        }

        logger.info("🤖 Chat backends ({}):", sortedClients.size());
        for (ChatCompletionClient client : sortedClients) {
            String status = client.isEnabled() ? "✅" : "❌";
            logger.info("   {} {} (priority: {})", status, client.getName(), client.getPriority());
        }
        if (!hasAvailableBackend()) {
            logger.warn("⚠️ No chat backend is enabled. Every batch will be left untranslated.");
        }
    }

    /**
     * Send one exchange, falling back through the enabled backends.
     *
     * @throws ContextLengthExceededException as soon as a backend reports the payload
     *         is too long, since a fallback with the same payload would fail alike
     * @throws TranslationBackendException when no backend answered
     */
    public String complete(String systemPrompt, String userContent) {
        if (mock) {
            return call(mockClient, systemPrompt, userContent);
        }

        TranslationBackendException lastError = null;
        for (ChatCompletionClient client : sortedClients) {
            if (!client.isEnabled()) {
                continue;
            }
            try {
                String response = call(client, systemPrompt, userContent);
                if (lastError != null) {
                    logger.info("✅ Fallback backend {} succeeded", client.getName());
                }
                return response;
            } catch (ContextLengthExceededException e) {
                throw e;
            } catch (TranslationBackendException e) {
                logger.warn("Backend {} failed: {}", client.getName(), e.getMessage());
                lastError = e;
            }
        }

        if (lastError != null) {
            throw lastError;
        }
        throw new TranslationBackendException("No chat backend is enabled");
    }

    private String call(ChatCompletionClient client, String systemPrompt, String userContent) {
        rateLimiter.acquire(client.getName());
        String response = null;
        try {
            response = client.complete(systemPrompt, userContent);
            return response;
        } finally {
            exchangeLog.record(client.getName(), systemPrompt, userContent, response);
        }
    }

    public boolean hasAvailableBackend() {
        if (mock) {
            return true;
        }
        return sortedClients.stream().anyMatch(ChatCompletionClient::isEnabled);
    }
}
