package com.example.slidetranslate.deck;

import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFShapeContainer;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;

import java.awt.geom.Rectangle2D;

/**
 * In-memory presentations for tests. Coordinates are in points; a new slide show is
 * 720 x 540 pt.
 */
public final class DeckFixtures {

    private DeckFixtures() {
    }

    public static XSLFTextBox textBox(XSLFShapeContainer container, double x, double y, double width, double height) {
        XSLFTextBox box = container.createTextBox();
        box.setAnchor(new Rectangle2D.Double(x, y, width, height));
        box.clearText();
        return box;
    }

    public static XSLFTextBox textBox(XSLFShapeContainer container, double x, double y, double width, double height,
                                      String text) {
        XSLFTextBox box = textBox(container, x, y, width, height);
        run(box.addNewTextParagraph(), text, null, false);
        return box;
    }

    public static XSLFTextRun run(XSLFTextParagraph paragraph, String text, Double size, boolean bold) {
        XSLFTextRun run = paragraph.addNewTextRun();
        run.setText(text);
        if (size != null) {
            run.setFontSize(size);
        }
        if (bold) {
            run.setBold(true);
        }
        return run;
    }

    public static DeckParagraph firstParagraph(XSLFTextBox box) {
        return new DeckParagraph(box.getTextParagraphs().get(0).getXmlObject());
    }

    public static SlideDeck deck(XMLSlideShow show) {
        return new SlideDeck(show);
    }
}
