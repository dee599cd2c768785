package com.example.slidetranslate.service.layout;

import com.example.slidetranslate.dto.translation.StyledRun;
import org.apache.poi.util.Units;

import java.util.ArrayList;
import java.util.List;

/**
 * Font-metric-free text width estimate. Code points above U+00FF count as full-width
 * (one em), everything else as 0.55 em. All widths are in EMU.
 */
public final class TextWidthEstimator {

    public static final double NOMINAL_FONT_SIZE_PT = 18.0;

    static final double FULL_WIDTH_FACTOR = 1.0;
    static final double HALF_WIDTH_FACTOR = 0.55;
    static final double WRAP_SAFETY = 0.95;

    private TextWidthEstimator() {
    }

    public static double charWidth(int codePoint, double fontSizePt) {
        double factor = codePoint > 255 ? FULL_WIDTH_FACTOR : HALF_WIDTH_FACTOR;
        return fontSizePt * Units.EMU_PER_POINT * factor;
    }

    public static double runWidth(StyledRun run) {
        if (run.isLineBreak() || run.getText() == null) {
            return 0;
        }
        double size = sizeOf(run);
        double width = 0;
        String text = run.getText();
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            width += charWidth(codePoint, size);
            i += Character.charCount(codePoint);
        }
        return width;
    }

    /**
     * Width of the runs laid out on one line, ignoring line breaks.
     */
    public static double linearWidth(List<StyledRun> runs) {
        double width = 0;
        for (StyledRun run : runs) {
            width += runWidth(run);
        }
        return width;
    }

    /**
     * Widths of the segments between hard line breaks. Always at least one segment.
     */
    public static List<Double> segmentWidths(List<StyledRun> runs) {
        List<Double> widths = new ArrayList<>();
        double current = 0;
        for (StyledRun run : runs) {
            if (run.isLineBreak()) {
                widths.add(current);
                current = 0;
            } else {
                current += runWidth(run);
            }
        }
        widths.add(current);
        return widths;
    }

    /**
     * Number of rendered lines the runs need in a box of the given width.
     */
    public static int estimateLines(List<StyledRun> runs, long availableWidthEmu) {
        double usable = availableWidthEmu * WRAP_SAFETY;
        int lines = 0;
        for (double width : segmentWidths(runs)) {
            lines += Math.max(1, (int) Math.ceil(width / usable));
        }
        return lines;
    }

    public static double maxFontSize(List<StyledRun> runs) {
        double max = 0;
        for (StyledRun run : runs) {
            max = Math.max(max, sizeOf(run));
        }
        return max > 0 ? max : NOMINAL_FONT_SIZE_PT;
    }

    static double sizeOf(StyledRun run) {
        Double size = run.getFontSizePt();
        return size != null && size > 0 ? size : NOMINAL_FONT_SIZE_PT;
    }
}
