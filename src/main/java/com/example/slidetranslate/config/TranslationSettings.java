package com.example.slidetranslate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;

/**
 * Translation settings read from the {@code translation.*} section of the
 * configuration file given on the command line.
 */
@Configuration
public class TranslationSettings {

    private static final Logger logger = LoggerFactory.getLogger(TranslationSettings.class);

    @Value("${translation.source-language:Japanese}")
    private String sourceLanguage;

    @Value("${translation.target-language:English}")
    private String targetLanguage;

    @Value("${translation.expansion-ratio:1.0}")
    private double expansionRatio;

    @Value("${translation.batch-size:20}")
    private int batchSize;

    @Value("${translation.max-parallel-requests:5}")
    private int maxParallelRequests;

    @Value("${translation.glossary-path:glossary.json}")
    private String glossaryPath;

    @Value("${translation.presentation-body-prompt:}")
    private String presentationBodyPrompt;

    @Value("${translation.constrained-text-prompt:}")
    private String constrainedTextPrompt;

    @Value("${translation.split-on-length-error:true}")
    private boolean splitOnLengthError;

    @Value("${translation.keep-raw-checkpoint:true}")
    private boolean keepRawCheckpoint;

    @PostConstruct
    public void initialize() {
        validate();
        logger.info("🌐 Translation settings: {} -> {} (expansion ratio {})",
                   sourceLanguage, targetLanguage, expansionRatio);
        logger.info("   - Batch size: {}, parallel requests: {}", batchSize, maxParallelRequests);
        logger.info("   - Glossary: {}", glossaryPath);
    }

    public void validate() {
        if (batchSize < 1) {
            throw new IllegalStateException("translation.batch-size must be at least 1, got " + batchSize);
        }
        if (maxParallelRequests < 1) {
            throw new IllegalStateException("translation.max-parallel-requests must be at least 1, got " + maxParallelRequests);
        }
        if (expansionRatio < 0 || Double.isNaN(expansionRatio)) {
            throw new IllegalStateException("translation.expansion-ratio must not be negative, got " + expansionRatio);
        }
        if (isBlank(sourceLanguage) || isBlank(targetLanguage)) {
            throw new IllegalStateException("translation.source-language and translation.target-language are required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public String getSourceLanguage() {
        return sourceLanguage;
    }

    public void setSourceLanguage(String sourceLanguage) {
        this.sourceLanguage = sourceLanguage;
    }

    public String getTargetLanguage() {
        return targetLanguage;
    }

    public void setTargetLanguage(String targetLanguage) {
        this.targetLanguage = targetLanguage;
    }

    public double getExpansionRatio() {
        return expansionRatio;
    }

    public void setExpansionRatio(double expansionRatio) {
        this.expansionRatio = expansionRatio;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxParallelRequests() {
        return maxParallelRequests;
    }

    public void setMaxParallelRequests(int maxParallelRequests) {
        this.maxParallelRequests = maxParallelRequests;
    }

    public String getGlossaryPath() {
        return glossaryPath;
    }

    public void setGlossaryPath(String glossaryPath) {
        this.glossaryPath = glossaryPath;
    }

    public String getPresentationBodyPrompt() {
        return presentationBodyPrompt;
    }

    public void setPresentationBodyPrompt(String presentationBodyPrompt) {
        this.presentationBodyPrompt = presentationBodyPrompt;
    }

    public String getConstrainedTextPrompt() {
        return constrainedTextPrompt;
    }

    public void setConstrainedTextPrompt(String constrainedTextPrompt) {
        this.constrainedTextPrompt = constrainedTextPrompt;
    }

    public boolean isSplitOnLengthError() {
        return splitOnLengthError;
    }

    public void setSplitOnLengthError(boolean splitOnLengthError) {
        this.splitOnLengthError = splitOnLengthError;
    }

    public boolean isKeepRawCheckpoint() {
        return keepRawCheckpoint;
    }

    public void setKeepRawCheckpoint(boolean keepRawCheckpoint) {
        this.keepRawCheckpoint = keepRawCheckpoint;
    }
}
