package com.example.slidetranslate.service.ai;

/**
 * A chat backend call failed: network error, timeout, HTTP error status or an
 * unusable response body.
 */
public class TranslationBackendException extends RuntimeException {

    public TranslationBackendException(String message) {
        super(message);
    }

    public TranslationBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
