package com.example.slidetranslate.dto.translation;

import com.example.slidetranslate.deck.DeckParagraph;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TranslationTask {
    private DeckParagraph paragraph;
    private String encodedMarkup;
    private int rawLength;  // characters before translation
    private int maxChars;   // translated-length budget, filled in by the orchestrator
    private TextContext context;
}
