package com.example.slidetranslate.dto.translation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchItem {
    private int id;       // batch-local, 0-based
    private String text;  // encoded markup
    private int limit;    // max characters for the translation
}
