package com.example.slidetranslate.service.translation;

import com.example.slidetranslate.dto.translation.StyledRun;
import com.example.slidetranslate.dto.translation.TextContext;
import com.example.slidetranslate.dto.translation.TranslationTask;
import com.example.slidetranslate.service.layout.FontFitCalculator;
import com.example.slidetranslate.service.layout.TextWidthEstimator;
import com.example.slidetranslate.service.markup.StyleMarkupCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a translated paragraph back into the document.
 */
@Component
public class ParagraphReconstructor {

    private static final Logger logger = LoggerFactory.getLogger(ParagraphReconstructor.class);

    /**
     * @return true when the paragraph was rewritten, false when the translation decoded
     *         to nothing and the original runs were kept
     */
    public boolean apply(TranslationTask task, String translatedMarkup) {
        List<StyledRun> originalRuns = task.getParagraph().getRuns();
        List<StyledRun> translatedRuns = StyleMarkupCodec.decode(translatedMarkup);
        if (isBlank(translatedRuns)) {
            logger.debug("Translation '{}' decoded to no text, keeping original", translatedMarkup);
            return false;
        }

        if (task.getContext() == TextContext.CONSTRAINED) {
            translatedRuns = shrinkToOriginalWidth(originalRuns, translatedRuns);
        }
        task.getParagraph().replaceRuns(translatedRuns);
        return true;
    }

    /**
     * Boxes in groups and tables do not grow, so a translation wider than its source
     * is scaled down by the width ratio.
     */
    static List<StyledRun> shrinkToOriginalWidth(List<StyledRun> originalRuns, List<StyledRun> translatedRuns) {
        double originalWidth = TextWidthEstimator.linearWidth(originalRuns);
        double translatedWidth = TextWidthEstimator.linearWidth(translatedRuns);
        if (translatedWidth <= 0) {
            return translatedRuns;
        }
        double ratio = Math.min(1.0, originalWidth / translatedWidth);
        if (ratio >= 1.0) {
            return translatedRuns;
        }

        Double fallbackSize = firstExplicitSize(originalRuns);
        List<StyledRun> shrunk = new ArrayList<>(translatedRuns.size());
        for (StyledRun run : translatedRuns) {
            Double base = run.getFontSizePt() != null ? run.getFontSizePt() : fallbackSize;
            if (base == null) {
                base = TextWidthEstimator.NOMINAL_FONT_SIZE_PT;
            }
            StyledRun copy = run.withText(run.getText());
            copy.setFontSizePt(Math.max(FontFitCalculator.MIN_FONT_SIZE_PT, base * ratio));
            shrunk.add(copy);
        }
        return shrunk;
    }

    private static Double firstExplicitSize(List<StyledRun> runs) {
        for (StyledRun run : runs) {
            if (run.getFontSizePt() != null) {
                return run.getFontSizePt();
            }
        }
        return null;
    }

    private static boolean isBlank(List<StyledRun> runs) {
        for (StyledRun run : runs) {
            if (!run.isLineBreak() && !run.getText().trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
