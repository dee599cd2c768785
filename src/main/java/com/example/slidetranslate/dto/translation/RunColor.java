package com.example.slidetranslate.dto.translation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Run color, either an explicit RGB value or a reference into the deck theme.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunColor {
    private String rgb;        // RRGGBB, upper case; null for theme colors
    private Integer themeId;   // scheme color index; null for RGB colors
    private Double brightness; // -1.0..1.0, theme colors only

    public static RunColor rgb(String hex) {
        return new RunColor(hex.toUpperCase(Locale.ROOT), null, null);
    }

    /**
     * Theme color reference. A brightness of zero is stored as null, the unmodified
     * theme color.
     */
    public static RunColor theme(int themeId, Double brightness) {
        Double normalized = brightness != null && brightness == 0.0 ? null : brightness;
        return new RunColor(null, themeId, normalized);
    }

    public boolean isTheme() {
        return themeId != null;
    }
}
