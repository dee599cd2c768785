package com.example.slidetranslate.service.translation;

import com.example.slidetranslate.deck.DeckFixtures;
import com.example.slidetranslate.deck.DeckParagraph;
import com.example.slidetranslate.dto.translation.StyledRun;
import com.example.slidetranslate.dto.translation.TextContext;
import com.example.slidetranslate.dto.translation.TranslationTask;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ParagraphReconstructorTest {

    private final ParagraphReconstructor reconstructor = new ParagraphReconstructor();
    private XMLSlideShow show;

    @BeforeEach
    void setUp() {
        show = new XMLSlideShow();
    }

    @AfterEach
    void tearDown() throws IOException {
        show.close();
    }

    private DeckParagraph paragraph(String text, Double size) {
        XSLFTextBox box = DeckFixtures.textBox(show.createSlide(), 0, 0, 200, 100);
        DeckFixtures.run(box.addNewTextParagraph(), text, size, false);
        return DeckFixtures.firstParagraph(box);
    }

    private static TranslationTask task(DeckParagraph paragraph, TextContext context) {
        return new TranslationTask(paragraph, "", 0, 0, context);
    }

    @Test
    void replacesRunsWithDecodedTranslation() {
        DeckParagraph paragraph = paragraph("売上が増加", 18.0);

        boolean applied = reconstructor.apply(task(paragraph, TextContext.STANDARD),
            "<sz v=\"18\"><b>Sales</b><sp/>grew</sz>");

        assertThat(applied).isTrue();
        assertThat(paragraph.getText()).isEqualTo("Sales grew");
        assertThat(paragraph.getRuns().get(0).isBold()).isTrue();
        assertThat(paragraph.getRuns().get(0).getFontSizePt()).isEqualTo(18.0);
    }

    @Test
    void blankTranslationKeepsOriginalRuns() {
        DeckParagraph paragraph = paragraph("売上", 18.0);

        assertThat(reconstructor.apply(task(paragraph, TextContext.STANDARD), "")).isFalse();
        assertThat(reconstructor.apply(task(paragraph, TextContext.STANDARD), "<b> </b><sp/>")).isFalse();

        assertThat(paragraph.getText()).isEqualTo("売上");
    }

    @Test
    void constrainedTranslationShrinksToOriginalWidth() {
        DeckParagraph paragraph = paragraph("AB", 20.0);

        reconstructor.apply(task(paragraph, TextContext.CONSTRAINED), "<sz v=\"20\">ABCD</sz>");

        assertThat(paragraph.getRuns().get(0).getFontSizePt()).isEqualTo(10.0);
    }

    @Test
    void constrainedShrinkFallsBackToOriginalSizeAndFloorsAtSixPoints() {
        DeckParagraph paragraph = paragraph("A", 10.0);

        reconstructor.apply(task(paragraph, TextContext.CONSTRAINED), "ABCDEFGHIJ");

        assertThat(paragraph.getRuns().get(0).getFontSizePt()).isEqualTo(6.0);
    }

    @Test
    void standardTranslationIsNeverShrunk() {
        DeckParagraph paragraph = paragraph("AB", 20.0);

        reconstructor.apply(task(paragraph, TextContext.STANDARD), "<sz v=\"20\">ABCDEFGH</sz>");

        assertThat(paragraph.getRuns().get(0).getFontSizePt()).isEqualTo(20.0);
    }

    @Test
    void narrowerConstrainedTranslationKeepsSizes() {
        List<StyledRun> original = List.of(sized("ABCDEF", 12.0));
        List<StyledRun> translated = List.of(sized("AB", 12.0));

        assertThat(ParagraphReconstructor.shrinkToOriginalWidth(original, translated)).isSameAs(translated);
    }

    private static StyledRun sized(String text, double size) {
        StyledRun run = StyledRun.plain(text);
        run.setFontSizePt(size);
        return run;
    }
}
