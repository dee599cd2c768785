package com.example.slidetranslate.dto.translation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * A maximal span of paragraph text sharing one character style.
 * A run carrying {@link #LINE_BREAK} as its text stands for a hard line break.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StyledRun {

    public static final String LINE_BREAK = "\u000B";

    private String text;
    private boolean bold;
    private boolean italic;
    private boolean underline;
    private boolean strike;
    private Double fontSizePt; // null = inherited
    private RunColor color;    // null = inherited

    public static StyledRun plain(String text) {
        StyledRun run = new StyledRun();
        run.setText(text);
        return run;
    }

    public static StyledRun lineBreak() {
        return plain(LINE_BREAK);
    }

    public boolean isLineBreak() {
        return LINE_BREAK.equals(text);
    }

    /**
     * Copy of this run's style carrying different text.
     */
    public StyledRun withText(String newText) {
        return new StyledRun(newText, bold, italic, underline, strike, fontSizePt, color);
    }

    public boolean hasSameStyle(StyledRun other) {
        return other != null
            && bold == other.bold
            && italic == other.italic
            && underline == other.underline
            && strike == other.strike
            && Objects.equals(fontSizePt, other.fontSizePt)
            && Objects.equals(color, other.color);
    }
}
