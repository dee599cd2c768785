package com.example.slidetranslate.service.layout;

import com.example.slidetranslate.deck.DeckParagraph;
import com.example.slidetranslate.deck.DeckShape;
import com.example.slidetranslate.deck.DeckSlide;
import com.example.slidetranslate.deck.GroupShape;
import com.example.slidetranslate.deck.SlideDeck;
import com.example.slidetranslate.deck.TableShape;
import com.example.slidetranslate.deck.TextContainer;
import com.example.slidetranslate.deck.TextShape;
import com.example.slidetranslate.dto.translation.StyledRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Second pass over a translated deck: widens text boxes into free space on their
 * right, then shrinks fonts wherever the text still overflows its box.
 */
@Service
public class LayoutReflowService {

    private static final Logger logger = LoggerFactory.getLogger(LayoutReflowService.class);

    /** Gap kept between a widened box and whatever stops it (0.1 inch). */
    static final long WIDEN_MARGIN_EMU = 91440L;

    private static final int MAX_FIT_PASSES = 32;

    public void adjust(SlideDeck deck) {
        List<DeckSlide> slides = deck.getSlides();
        long slideWidth = deck.getSlideWidth();
        for (DeckSlide slide : slides) {
            logger.debug("Reflowing slide {}/{}", slide.getNumber(), slides.size());
            List<DeckShape> shapes = slide.getShapes();
            for (int i = 0; i < shapes.size(); i++) {
                DeckShape shape = shapes.get(i);
                try {
                    adjustShape(shape, i, shapes, slideWidth);
                } catch (RuntimeException e) {
                    logger.warn("⚠️ Skipping layout of shape '{}' on slide {}: {}",
                        shape.getName(), slide.getNumber(), e.getMessage());
                }
            }
        }
        logger.info("📐 Layout reflow finished for {} slides", slides.size());
    }

    private void adjustShape(DeckShape shape, int index, List<DeckShape> siblings, long slideWidth) {
        switch (shape.getKind()) {
            case TEXT:
                TextShape textShape = (TextShape) shape;
                if (textShape.getTextContainer().hasText()) {
                    widen(textShape, index, siblings, slideWidth);
                }
                fit(textShape.getTextContainer());
                break;
            case TABLE:
                for (TextContainer cell : ((TableShape) shape).getCells()) {
                    fit(cell);
                }
                break;
            case GROUP:
                fitMembers((GroupShape) shape);
                break;
            case OPAQUE:
            default:
                break;
        }
    }

    private void fitMembers(GroupShape group) {
        for (DeckShape member : group.getChildren()) {
            switch (member.getKind()) {
                case TEXT:
                    fit(((TextShape) member).getTextContainer());
                    break;
                case TABLE:
                    for (TextContainer cell : ((TableShape) member).getCells()) {
                        fit(cell);
                    }
                    break;
                case GROUP:
                    fitMembers((GroupShape) member);
                    break;
                case OPAQUE:
                default:
                    break;
            }
        }
    }

    /**
     * Grows the shape rightwards up to the nearest sibling that starts at or after its
     * right edge and overlaps it vertically, or up to the slide edge. Never shrinks.
     */
    void widen(TextShape shape, int index, List<DeckShape> siblings, long slideWidth) {
        long left = shape.getLeft();
        long top = shape.getTop();
        long right = shape.getRight();
        long bottom = shape.getBottom();

        long limit = slideWidth;
        for (int i = 0; i < siblings.size(); i++) {
            if (i == index) {
                continue;
            }
            DeckShape other = siblings.get(i);
            boolean toTheRight = other.getLeft() >= right;
            boolean overlapsVertically = other.getTop() < bottom && other.getBottom() > top;
            if (toTheRight && overlapsVertically && other.getLeft() < limit) {
                limit = other.getLeft();
            }
        }

        long newWidth = limit - left - WIDEN_MARGIN_EMU;
        if (newWidth > shape.getWidth()) {
            logger.debug("Widening '{}' from {} to {} EMU", shape.getName(), shape.getWidth(), newWidth);
            shape.setWidth(newWidth);
        }
    }

    /**
     * Shrinks every run of the container by a common factor until the estimated text
     * height fits the available height or the largest run is at the minimum size.
     * Line counts are re-estimated after each step since they do not always drop with
     * the font size.
     */
    void fit(TextContainer container) {
        long availableWidth = container.getAvailableWidth();
        long availableHeight = container.getAvailableHeight();
        if (availableWidth <= 0 || availableHeight <= 0) {
            return;
        }

        List<DeckParagraph> paragraphs = container.getParagraphs();
        for (int pass = 0; pass < MAX_FIT_PASSES; pass++) {
            List<StyledRun> allRuns = new ArrayList<>();
            int lines = 0;
            for (DeckParagraph paragraph : paragraphs) {
                List<StyledRun> runs = paragraph.getRuns();
                allRuns.addAll(runs);
                lines += TextWidthEstimator.estimateLines(runs, availableWidth);
            }
            if (allRuns.isEmpty()) {
                return;
            }
            if (pass == 0) {
                container.enableWordWrap();
            }

            double maxFontSize = TextWidthEstimator.maxFontSize(allRuns);
            double scale = FontFitCalculator.computeScale(lines, maxFontSize, availableHeight);
            if (scale >= 1.0 || maxFontSize <= FontFitCalculator.MIN_FONT_SIZE_PT) {
                return;
            }

            logger.debug("Shrinking text by {} ({} estimated lines, pass {})",
                String.format("%.3f", scale), lines, pass + 1);
            for (DeckParagraph paragraph : paragraphs) {
                paragraph.resizeFonts(size -> FontFitCalculator.scaledSize(size, scale));
            }
        }
        logger.warn("⚠️ Text still overflows after {} shrink passes", MAX_FIT_PASSES);
    }
}
