package com.example.slidetranslate.service.translation;

import com.example.slidetranslate.config.TranslationSettings;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Character budget of a translation, derived from the source length and the
 * configured expansion ratio between Japanese and English.
 */
@Component
public class CharacterBudgetCalculator {

    @Autowired
    private TranslationSettings settings;

    public int maxChars(int rawLength) {
        double ratio = ratio(settings.getSourceLanguage(), settings.getTargetLanguage(), settings.getExpansionRatio());
        return (int) (rawLength * ratio);
    }

    /**
     * Expansion ratio for Japanese to English, its inverse for English to Japanese,
     * 1.0 for any other pair. Language names match case-insensitively by substring.
     */
    public static double ratio(String sourceLanguage, String targetLanguage, double expansionRatio) {
        String source = sourceLanguage == null ? "" : sourceLanguage.toLowerCase(Locale.ROOT);
        String target = targetLanguage == null ? "" : targetLanguage.toLowerCase(Locale.ROOT);
        if (source.contains("japanese") && target.contains("english")) {
            return expansionRatio;
        }
        if (source.contains("english") && target.contains("japanese") && expansionRatio != 0) {
            return 1.0 / expansionRatio;
        }
        return 1.0;
    }
}
