package com.example.slidetranslate.service;

import com.example.slidetranslate.cli.CommandLineOptions;
import com.example.slidetranslate.config.TranslationSettings;
import com.example.slidetranslate.deck.SlideDeck;
import com.example.slidetranslate.dto.translation.TranslationSummary;
import com.example.slidetranslate.service.layout.LayoutReflowService;
import com.example.slidetranslate.service.translation.TranslationOrchestrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * End-to-end run: translate the deck, save a raw checkpoint, reopen it, reflow the
 * layout and save the final file.
 */
@Service
public class PresentationTranslationService {

    private static final Logger logger = LoggerFactory.getLogger(PresentationTranslationService.class);

    @Autowired
    private PresentationFileService fileService;

    @Autowired
    private TranslationOrchestrationService orchestrationService;

    @Autowired
    private LayoutReflowService layoutReflowService;

    @Autowired
    private TranslationSettings settings;

    /**
     * @return the path of the written output file
     */
    public Path translate(Path input, Path output) throws IOException {
        Path rawCheckpoint = CommandLineOptions.siblingWithSuffix(output, "_raw");
        logger.info("📄 Translating {} ({} -> {})", input, settings.getSourceLanguage(), settings.getTargetLanguage());

        try (SlideDeck deck = fileService.open(input)) {
            TranslationSummary summary = orchestrationService.translateDeck(deck);
            logger.info("Translation pass done: {} translated, {} kept original", summary.getTranslated(), summary.getSkipped());
            fileService.save(deck, rawCheckpoint);
        }

        try (SlideDeck deck = fileService.open(rawCheckpoint)) {
            layoutReflowService.adjust(deck);
            fileService.save(deck, output);
        }

        if (!settings.isKeepRawCheckpoint()) {
            Files.deleteIfExists(rawCheckpoint);
            logger.debug("Removed raw checkpoint {}", rawCheckpoint);
        }
        return output;
    }
}
