package com.example.slidetranslate.service.layout;

import org.apache.poi.util.Units;

/**
 * Finds the uniform font scale that makes an overflowing text body fit its box.
 *
 * <p>Shrinking every font by {@code k} shrinks the line height by {@code k} and, for
 * wrapped text, the line count by roughly {@code k} too, so the estimated height goes
 * with {@code k²}. Where the line count does not drop (hard breaks, short lines) one
 * step falls short, so callers re-estimate and apply another step.
 */
public final class FontFitCalculator {

    public static final double MIN_FONT_SIZE_PT = 6.0;
    static final double LINE_SPACING = 1.2;
    static final double SAFETY_MARGIN = 0.95;

    private FontFitCalculator() {
    }

    public static double estimateHeight(int lines, double maxFontSizePt) {
        return lines * maxFontSizePt * LINE_SPACING;
    }

    /**
     * @param lines estimated rendered lines
     * @param maxFontSizePt largest font size in the body
     * @param availableHeightEmu text height of the box
     * @return scale factor in (0, 1], or 1 when the text fits or the box has no geometry
     */
    public static double computeScale(int lines, double maxFontSizePt, long availableHeightEmu) {
        if (availableHeightEmu <= 0 || lines <= 0 || maxFontSizePt <= 0) {
            return 1.0;
        }
        double availablePt = availableHeightEmu / (double) Units.EMU_PER_POINT;
        double estimatedPt = estimateHeight(lines, maxFontSizePt);
        if (estimatedPt <= availablePt) {
            return 1.0;
        }
        return Math.sqrt(availablePt / estimatedPt) * SAFETY_MARGIN;
    }

    /**
     * Applies the scale to a run size, using the nominal size for inherited sizes.
     */
    public static double scaledSize(Double sizePt, double scale) {
        double base = sizePt != null && sizePt > 0 ? sizePt : TextWidthEstimator.NOMINAL_FONT_SIZE_PT;
        return Math.max(MIN_FONT_SIZE_PT, base * scale);
    }
}
