package com.example.slidetranslate.deck;

import org.apache.poi.util.Units;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextShape;

import java.util.ArrayList;
import java.util.List;

/**
 * A text frame: the body of a text shape or of a table cell, with the box it has to
 * fit in.
 */
public class TextContainer {

    private final XSLFTextShape frame;
    private final long boxWidth;
    private final long boxHeight;

    TextContainer(XSLFTextShape frame, long boxWidth, long boxHeight) {
        this.frame = frame;
        this.boxWidth = boxWidth;
        this.boxHeight = boxHeight;
    }

    public List<DeckParagraph> getParagraphs() {
        List<DeckParagraph> paragraphs = new ArrayList<>();
        for (XSLFTextParagraph paragraph : frame.getTextParagraphs()) {
            paragraphs.add(new DeckParagraph(paragraph.getXmlObject()));
        }
        return paragraphs;
    }

    /**
     * Width available to text in EMU: the box minus its left and right insets.
     */
    public long getAvailableWidth() {
        return boxWidth - Units.toEMU(frame.getLeftInset() + frame.getRightInset());
    }

    /**
     * Height available to text in EMU: the box minus its top and bottom insets.
     */
    public long getAvailableHeight() {
        return boxHeight - Units.toEMU(frame.getTopInset() + frame.getBottomInset());
    }

    public void enableWordWrap() {
        frame.setWordWrap(true);
    }

    public boolean hasText() {
        for (DeckParagraph paragraph : getParagraphs()) {
            if (!paragraph.getText().trim().isEmpty()) {
                return true;
            }
        }
        return false;
    }

    public long getBoxWidth() {
        return boxWidth;
    }

    public long getBoxHeight() {
        return boxHeight;
    }
}
