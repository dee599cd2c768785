package com.example.slidetranslate.dto.translation;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters of one translation pass, logged when the pass ends.
 */
@Data
@NoArgsConstructor
public class TranslationSummary {
    private int slides;
    private int paragraphs;
    private int translated;
    private int skipped;
    private int batches;
    private int emptyBatches;

    public void addSkipped(int count) {
        skipped += count;
    }

    public void addTranslated(int count) {
        translated += count;
    }
}
