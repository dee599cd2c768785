package com.example.slidetranslate.service.translation;

import com.example.slidetranslate.config.TranslationSettings;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CharacterBudgetCalculatorTest {

    private CharacterBudgetCalculator calculator(String source, String target, double ratio) {
        TranslationSettings settings = new TranslationSettings();
        settings.setSourceLanguage(source);
        settings.setTargetLanguage(target);
        settings.setExpansionRatio(ratio);
        CharacterBudgetCalculator calculator = new CharacterBudgetCalculator();
        ReflectionTestUtils.setField(calculator, "settings", settings);
        return calculator;
    }

    @Test
    void japaneseToEnglishUsesExpansionRatio() {
        assertThat(calculator("Japanese", "English", 1.7).maxChars(10)).isEqualTo(17);
    }

    @Test
    void englishToJapaneseUsesInverseRatioAndTruncates() {
        assertThat(calculator("English", "Japanese", 1.7).maxChars(100)).isEqualTo(58);
    }

    @Test
    void otherPairsKeepTheSourceLength() {
        assertThat(calculator("German", "French", 1.7).maxChars(40)).isEqualTo(40);
    }

    @Test
    void languageNamesMatchCaseInsensitivelyBySubstring() {
        assertThat(CharacterBudgetCalculator.ratio("JAPANESE (ja-JP)", "british english", 2.0)).isEqualTo(2.0);
        assertThat(CharacterBudgetCalculator.ratio("English", "Japanese", 4.0)).isCloseTo(0.25, within(1e-9));
    }

    @Test
    void zeroRatioIsNotInverted() {
        assertThat(CharacterBudgetCalculator.ratio("English", "Japanese", 0.0)).isEqualTo(1.0);
        assertThat(calculator("Japanese", "English", 0.0).maxChars(25)).isZero();
    }
}
