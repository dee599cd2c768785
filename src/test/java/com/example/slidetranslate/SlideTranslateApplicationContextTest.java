package com.example.slidetranslate;

import com.example.slidetranslate.config.TranslationSettings;
import com.example.slidetranslate.service.PresentationTranslationService;
import com.example.slidetranslate.service.ai.ChatBackendService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {"ai.mock=true", "translation.max-parallel-requests=3"})
class SlideTranslateApplicationContextTest {

    @Autowired
    private PresentationTranslationService presentationTranslationService;

    @Autowired
    private ChatBackendService chatBackendService;

    @Autowired
    private TranslationSettings settings;

    @Autowired
    @Qualifier("translationExecutor")
    private ThreadPoolTaskExecutor translationExecutor;

    @Test
    void wiresPipelineWithPackagedDefaults() {
        assertThat(presentationTranslationService).isNotNull();
        assertThat(chatBackendService.hasAvailableBackend()).isTrue();
        assertThat(settings.getBatchSize()).isEqualTo(20);
        assertThat(settings.getPresentationBodyPrompt()).contains("{target_language}");
        assertThat(translationExecutor.getMaxPoolSize()).isEqualTo(3);
    }
}
