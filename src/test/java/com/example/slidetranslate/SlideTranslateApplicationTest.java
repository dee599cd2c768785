package com.example.slidetranslate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SlideTranslateApplicationTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void usageErrorExitsWithOne() {
        int status = SlideTranslateApplication.run(new String[]{"--bogus"}, out);

        assertThat(status).isEqualTo(1);
        assertThat(output()).startsWith("Error: ").hasLineCount(1);
    }

    @Test
    void missingInputExitsWithOne() {
        int status = SlideTranslateApplication.run(
            new String[]{tempDir.resolve("absent.pptx").toString()}, out);

        assertThat(status).isEqualTo(1);
        assertThat(output()).contains("not found").hasLineCount(1);
    }

    @Test
    void missingConfigExitsBeforeTouchingTheDeck() throws IOException {
        Path input = Files.createFile(tempDir.resolve("deck.pptx"));

        int status = SlideTranslateApplication.run(new String[]{
            input.toString(), "--config", tempDir.resolve("absent.yaml").toString()}, out);

        assertThat(status).isEqualTo(1);
        assertThat(output()).startsWith("Error: Config file not found").hasLineCount(1);
        assertThat(tempDir.resolve("deck_translated.pptx")).doesNotExist();
    }
}
