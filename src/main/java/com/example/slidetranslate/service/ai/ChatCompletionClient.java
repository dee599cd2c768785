package com.example.slidetranslate.service.ai;

/**
 * Chat-style language model backend: one system instruction, one user message, one
 * text answer.
 */
public interface ChatCompletionClient {

    /**
     * Get the name of this backend
     */
    String getName();

    /**
     * Check if this backend is enabled and configured
     */
    boolean isEnabled();

    /**
     * Get backend priority (lower number = higher priority)
     * Used for fallback ordering
     */
    int getPriority();

    /**
     * Send one exchange to the model.
     *
     * @param systemPrompt instruction message
     * @param userContent user message
     * @return the model's answer, never null
     * @throws TranslationBackendException if the call fails
     */
    String complete(String systemPrompt, String userContent);
}
