package com.example.slidetranslate.dto.translation;

/**
 * Structural context of a paragraph. STANDARD text sits in a top-level text frame
 * whose box may be widened later; CONSTRAINED text lives in a table cell or a group
 * member and can only be fitted by shrinking its font.
 */
public enum TextContext {
    STANDARD,
    CONSTRAINED
}
