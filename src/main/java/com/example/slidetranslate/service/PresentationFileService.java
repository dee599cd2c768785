package com.example.slidetranslate.service;

import com.example.slidetranslate.deck.SlideDeck;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes .pptx files.
 */
@Service
public class PresentationFileService {

    private static final Logger logger = LoggerFactory.getLogger(PresentationFileService.class);

    public SlideDeck open(Path file) throws IOException {
        logger.debug("Opening presentation {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return new SlideDeck(new XMLSlideShow(in));
        }
    }

    public void save(SlideDeck deck, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(file)) {
            deck.write(out);
        }
        logger.info("💾 Saved presentation to {}", file);
    }
}
