package com.example.slidetranslate.deck;

import com.example.slidetranslate.dto.translation.StyledRun;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.drawingml.x2006.main.CTRegularTextRun;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextCharacterProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextField;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextLineBreak;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextParagraph;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A paragraph of a text frame, read and written as a sequence of {@link StyledRun}s.
 *
 * <p>Works directly on the paragraph XML so that every read reflects the current
 * document state, including runs written earlier in the same pass.
 */
public class DeckParagraph {

    private final CTTextParagraph paragraph;

    public DeckParagraph(CTTextParagraph paragraph) {
        this.paragraph = paragraph;
    }

    public List<StyledRun> getRuns() {
        List<StyledRun> runs = new ArrayList<>();
        for (XmlObject element : runElements()) {
            if (element instanceof CTRegularTextRun) {
                CTRegularTextRun run = (CTRegularTextRun) element;
                if (run.getT() != null && !run.getT().isEmpty()) {
                    runs.add(RunPropertiesMapper.toStyledRun(run.getT(), run.getRPr()));
                }
            } else if (element instanceof CTTextLineBreak) {
                runs.add(RunPropertiesMapper.toStyledRun(StyledRun.LINE_BREAK, ((CTTextLineBreak) element).getRPr()));
            } else if (element instanceof CTTextField) {
                CTTextField field = (CTTextField) element;
                if (field.getT() != null && !field.getT().isEmpty()) {
                    runs.add(RunPropertiesMapper.toStyledRun(field.getT(), field.getRPr()));
                }
            }
        }
        return runs;
    }

    public String getText() {
        StringBuilder text = new StringBuilder();
        for (StyledRun run : getRuns()) {
            text.append(run.isLineBreak() ? "\n" : run.getText());
        }
        return text.toString();
    }

    /**
     * Discards every run of the paragraph and writes {@code runs} in their place.
     * Character properties that runs do not model (typeface, kerning, ...) are taken
     * over from the first original run. The new runs are built on a detached paragraph
     * first, so a failure leaves the paragraph untouched.
     */
    public void replaceRuns(List<StyledRun> runs) {
        CTTextCharacterProperties template = firstRunProperties();
        CTTextParagraph staged = CTTextParagraph.Factory.newInstance();
        for (StyledRun run : runs) {
            CTTextCharacterProperties properties;
            if (run.isLineBreak()) {
                properties = staged.addNewBr().addNewRPr();
            } else {
                CTRegularTextRun textRun = staged.addNewR();
                properties = textRun.addNewRPr();
                textRun.setT(run.getText());
            }
            if (template != null) {
                properties.set(template);
            }
            RunPropertiesMapper.apply(run, properties);
        }

        clearRuns();
        try (XmlCursor cursor = staged.newCursor()) {
            if (cursor.toFirstChild()) {
                do {
                    XmlObject element = cursor.getObject();
                    if (element instanceof CTRegularTextRun) {
                        paragraph.addNewR().set(element);
                    } else if (element instanceof CTTextLineBreak) {
                        paragraph.addNewBr().set(element);
                    }
                } while (cursor.toNextSibling());
            }
        }
    }

    /**
     * Rewrites the font size of every run. The sizer receives the run's explicit size
     * in points, or null when the size is inherited, and returns the new size or null
     * to leave the run untouched.
     */
    public void resizeFonts(UnaryOperator<Double> sizer) {
        for (XmlObject element : runElements()) {
            CTTextCharacterProperties properties = propertiesOf(element);
            Double current = properties != null && properties.isSetSz() ? properties.getSz() / 100.0 : null;
            Double next = sizer.apply(current);
            if (next == null) {
                continue;
            }
            if (properties == null) {
                properties = addPropertiesTo(element);
            }
            RunPropertiesMapper.writeSize(properties, next);
        }
    }

    private List<XmlObject> runElements() {
        List<XmlObject> elements = new ArrayList<>();
        try (XmlCursor cursor = paragraph.newCursor()) {
            if (cursor.toFirstChild()) {
                do {
                    XmlObject element = cursor.getObject();
                    if (element instanceof CTRegularTextRun
                        || element instanceof CTTextLineBreak
                        || element instanceof CTTextField) {
                        elements.add(element);
                    }
                } while (cursor.toNextSibling());
            }
        }
        return elements;
    }

    private CTTextCharacterProperties firstRunProperties() {
        for (XmlObject element : runElements()) {
            if (element instanceof CTRegularTextRun) {
                CTTextCharacterProperties properties = ((CTRegularTextRun) element).getRPr();
                return properties == null ? null : (CTTextCharacterProperties) properties.copy();
            }
        }
        return null;
    }

    private void clearRuns() {
        for (int i = paragraph.sizeOfRArray() - 1; i >= 0; i--) {
            paragraph.removeR(i);
        }
        for (int i = paragraph.sizeOfBrArray() - 1; i >= 0; i--) {
            paragraph.removeBr(i);
        }
        for (int i = paragraph.sizeOfFldArray() - 1; i >= 0; i--) {
            paragraph.removeFld(i);
        }
    }

    private static CTTextCharacterProperties propertiesOf(XmlObject element) {
        if (element instanceof CTRegularTextRun) {
            return ((CTRegularTextRun) element).getRPr();
        }
        if (element instanceof CTTextLineBreak) {
            return ((CTTextLineBreak) element).getRPr();
        }
        return ((CTTextField) element).getRPr();
    }

    private static CTTextCharacterProperties addPropertiesTo(XmlObject element) {
        if (element instanceof CTRegularTextRun) {
            return ((CTRegularTextRun) element).addNewRPr();
        }
        if (element instanceof CTTextLineBreak) {
            return ((CTTextLineBreak) element).addNewRPr();
        }
        return ((CTTextField) element).addNewRPr();
    }
}
