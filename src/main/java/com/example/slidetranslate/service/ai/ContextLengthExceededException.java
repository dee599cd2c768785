package com.example.slidetranslate.service.ai;

/**
 * The backend rejected a request because prompt and payload exceed the model's
 * context window. Smaller batches may still succeed.
 */
public class ContextLengthExceededException extends TranslationBackendException {

    public ContextLengthExceededException(String message) {
        super(message);
    }
}
