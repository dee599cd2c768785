package com.example.slidetranslate.deck;

import com.example.slidetranslate.dto.translation.RunColor;
import com.example.slidetranslate.dto.translation.StyledRun;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.drawingml.x2006.main.CTSchemeColor;
import org.openxmlformats.schemas.drawingml.x2006.main.CTSolidColorFillProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextCharacterProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.STSchemeColorVal;
import org.openxmlformats.schemas.drawingml.x2006.main.STTextStrikeType;
import org.openxmlformats.schemas.drawingml.x2006.main.STTextUnderlineType;

import javax.xml.namespace.QName;
import java.util.List;
import java.util.Locale;

/**
 * Maps DrawingML character properties ({@code a:rPr}) to and from {@link StyledRun}.
 * Only properties set on the run itself are read; inherited values stay null.
 */
final class RunPropertiesMapper {

    private static final QName VAL = new QName("val");
    private static final int PERCENT = 100_000;

    private RunPropertiesMapper() {
    }

    static StyledRun toStyledRun(String text, CTTextCharacterProperties properties) {
        StyledRun run = StyledRun.plain(text);
        if (properties == null) {
            return run;
        }
        run.setBold(properties.isSetB() && properties.getB());
        run.setItalic(properties.isSetI() && properties.getI());
        run.setUnderline(properties.isSetU() && properties.getU() != STTextUnderlineType.NONE);
        run.setStrike(properties.isSetStrike() && properties.getStrike() != STTextStrikeType.NO_STRIKE);
        if (properties.isSetSz()) {
            run.setFontSizePt(properties.getSz() / 100.0);
        }
        if (properties.isSetSolidFill()) {
            run.setColor(readColor(properties.getSolidFill()));
        }
        return run;
    }

    /**
     * Writes the style of {@code run} onto {@code properties}, replacing any style
     * already there. Unset flags fall back to inheritance rather than forcing "off".
     */
    static void apply(StyledRun run, CTTextCharacterProperties properties) {
        clearStyle(properties);
        if (run.isBold()) {
            properties.setB(true);
        }
        if (run.isItalic()) {
            properties.setI(true);
        }
        if (run.isUnderline()) {
            properties.setU(STTextUnderlineType.SNG);
        }
        if (run.isStrike()) {
            properties.setStrike(STTextStrikeType.SNG_STRIKE);
        }
        if (run.getFontSizePt() != null) {
            writeSize(properties, run.getFontSizePt());
        }
        if (run.getColor() != null) {
            writeColor(properties, run.getColor());
        }
    }

    static void writeSize(CTTextCharacterProperties properties, double sizePt) {
        // a:rPr/@sz is in hundredths of a point, 1..4000 pt
        int hundredths = (int) Math.round(sizePt * 100);
        properties.setSz(Math.max(100, Math.min(400_000, hundredths)));
    }

    private static void clearStyle(CTTextCharacterProperties properties) {
        if (properties.isSetB()) {
            properties.unsetB();
        }
        if (properties.isSetI()) {
            properties.unsetI();
        }
        if (properties.isSetU()) {
            properties.unsetU();
        }
        if (properties.isSetStrike()) {
            properties.unsetStrike();
        }
        if (properties.isSetSz()) {
            properties.unsetSz();
        }
        if (properties.isSetSolidFill()) {
            properties.unsetSolidFill();
        }
        // the translated text is no longer in the source language
        if (properties.isSetLang()) {
            properties.unsetLang();
        }
        if (properties.isSetAltLang()) {
            properties.unsetAltLang();
        }
        if (properties.isSetErr()) {
            properties.unsetErr();
        }
    }

    private static RunColor readColor(CTSolidColorFillProperties fill) {
        if (fill.isSetSrgbClr()) {
            byte[] rgb = fill.getSrgbClr().getVal();
            if (rgb != null && rgb.length == 3) {
                return RunColor.rgb(String.format(Locale.ROOT, "%02X%02X%02X", rgb[0] & 0xFF, rgb[1] & 0xFF, rgb[2] & 0xFF));
            }
        }
        if (fill.isSetSchemeClr()) {
            CTSchemeColor scheme = fill.getSchemeClr();
            if (scheme.getVal() != null) {
                return RunColor.theme(scheme.getVal().intValue(), readBrightness(scheme));
            }
        }
        return null;
    }

    private static void writeColor(CTTextCharacterProperties properties, RunColor color) {
        if (color.isTheme()) {
            STSchemeColorVal.Enum value = STSchemeColorVal.Enum.forInt(color.getThemeId());
            if (value == null) {
                return;
            }
            clearFill(properties);
            CTSchemeColor scheme = properties.addNewSolidFill().addNewSchemeClr();
            scheme.setVal(value);
            writeBrightness(scheme, color.getBrightness());
            return;
        }
        String hex = color.getRgb();
        if (hex == null || hex.length() != 6) {
            return;
        }
        clearFill(properties);
        properties.addNewSolidFill().addNewSrgbClr().setVal(new byte[]{
            (byte) Integer.parseInt(hex.substring(0, 2), 16),
            (byte) Integer.parseInt(hex.substring(2, 4), 16),
            (byte) Integer.parseInt(hex.substring(4, 6), 16)
        });
    }

    private static void clearFill(CTTextCharacterProperties properties) {
        if (properties.isSetNoFill()) {
            properties.unsetNoFill();
        }
        if (properties.isSetGradFill()) {
            properties.unsetGradFill();
        }
        if (properties.isSetPattFill()) {
            properties.unsetPattFill();
        }
        if (properties.isSetBlipFill()) {
            properties.unsetBlipFill();
        }
        if (properties.isSetGrpFill()) {
            properties.unsetGrpFill();
        }
        if (properties.isSetSolidFill()) {
            properties.unsetSolidFill();
        }
    }

    /**
     * Brightness in the -1..1 convention: a positive value tints towards white
     * (lumMod + lumOff), a negative one shades towards black (lumMod only).
     */
    private static Double readBrightness(CTSchemeColor scheme) {
        Integer lumOff = firstPercent(scheme.getLumOffList());
        if (lumOff != null) {
            return lumOff / (double) PERCENT;
        }
        Integer lumMod = firstPercent(scheme.getLumModList());
        if (lumMod != null) {
            return lumMod / (double) PERCENT - 1.0;
        }
        return null;
    }

    private static void writeBrightness(CTSchemeColor scheme, Double brightness) {
        if (brightness == null || brightness == 0.0) {
            return;
        }
        double clamped = Math.max(-1.0, Math.min(1.0, brightness));
        if (clamped > 0) {
            setPercent(scheme.addNewLumMod(), (int) Math.round((1.0 - clamped) * PERCENT));
            setPercent(scheme.addNewLumOff(), (int) Math.round(clamped * PERCENT));
        } else {
            setPercent(scheme.addNewLumMod(), (int) Math.round((1.0 + clamped) * PERCENT));
        }
    }

    // percentages are read through the cursor: the attribute may be "75000" or "75%"
    private static Integer firstPercent(List<? extends XmlObject> percentages) {
        if (percentages == null || percentages.isEmpty()) {
            return null;
        }
        try (XmlCursor cursor = percentages.get(0).newCursor()) {
            String raw = cursor.getAttributeText(VAL);
            if (raw == null) {
                return null;
            }
            raw = raw.trim();
            try {
                if (raw.endsWith("%")) {
                    return (int) Math.round(Double.parseDouble(raw.substring(0, raw.length() - 1)) * 1000);
                }
                return Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }

    private static void setPercent(XmlObject percentage, int value) {
        try (XmlCursor cursor = percentage.newCursor()) {
            cursor.setAttributeText(VAL, Integer.toString(value));
        }
    }
}
