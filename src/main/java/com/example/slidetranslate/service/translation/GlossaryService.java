package com.example.slidetranslate.service.translation;

import com.example.slidetranslate.config.TranslationSettings;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Term list handed to the model with every batch. Read once, lazily, from the JSON
 * object at {@code translation.glossary-path}; a missing or broken file means no
 * glossary.
 */
@Service
public class GlossaryService {

    private static final Logger logger = LoggerFactory.getLogger(GlossaryService.class);

    @Autowired
    private TranslationSettings settings;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private volatile Map<String, String> glossary;

    public Map<String, String> getGlossary() {
        Map<String, String> loaded = glossary;
        if (loaded == null) {
            synchronized (this) {
                if (glossary == null) {
                    glossary = load(Paths.get(settings.getGlossaryPath()));
                }
                loaded = glossary;
            }
        }
        return loaded;
    }

    Map<String, String> load(Path path) {
        if (!Files.isRegularFile(path)) {
            logger.info("Glossary file '{}' not found, translating without glossary", path);
            return Collections.emptyMap();
        }
        try {
            Map<String, String> terms = objectMapper.readValue(path.toFile(),
                new TypeReference<LinkedHashMap<String, String>>() {});
            logger.info("📖 Loaded {} glossary terms from {}", terms.size(), path);
            return Collections.unmodifiableMap(terms);
        } catch (IOException e) {
            logger.warn("⚠️ Error loading glossary {}: {}. Translating without glossary.", path, e.getMessage());
            return Collections.emptyMap();
        }
    }
}
