package com.example.slidetranslate.service.translation;

import com.example.slidetranslate.deck.DeckParagraph;
import com.example.slidetranslate.deck.DeckShape;
import com.example.slidetranslate.deck.GroupShape;
import com.example.slidetranslate.deck.TableShape;
import com.example.slidetranslate.deck.TextContainer;
import com.example.slidetranslate.deck.TextShape;
import com.example.slidetranslate.dto.translation.StyledRun;
import com.example.slidetranslate.dto.translation.TextContext;
import com.example.slidetranslate.dto.translation.TranslationTask;
import com.example.slidetranslate.service.markup.StyleMarkupCodec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the translatable paragraphs of a shape tree. Text inside groups and
 * tables is {@link TextContext#CONSTRAINED}: those boxes are not widened later.
 */
@Component
public class DocumentWalker {

    public List<TranslationTask> walk(DeckShape shape, TextContext context) {
        List<TranslationTask> tasks = new ArrayList<>();
        switch (shape.getKind()) {
            case GROUP:
                for (DeckShape child : ((GroupShape) shape).getChildren()) {
                    tasks.addAll(walk(child, TextContext.CONSTRAINED));
                }
                break;
            case TABLE:
                for (TextContainer cell : ((TableShape) shape).getCells()) {
                    tasks.addAll(walkContainer(cell, TextContext.CONSTRAINED));
                }
                break;
            case TEXT:
                tasks.addAll(walkContainer(((TextShape) shape).getTextContainer(), context));
                break;
            case OPAQUE:
            default:
                break;
        }
        return tasks;
    }

    public List<TranslationTask> walkContainer(TextContainer container, TextContext context) {
        List<TranslationTask> tasks = new ArrayList<>();
        for (DeckParagraph paragraph : container.getParagraphs()) {
            List<StyledRun> runs = paragraph.getRuns();
            if (paragraph.getText().trim().isEmpty()) {
                continue;
            }
            tasks.add(new TranslationTask(paragraph, StyleMarkupCodec.encode(runs), rawLength(runs), 0, context));
        }
        return tasks;
    }

    static int rawLength(List<StyledRun> runs) {
        int length = 0;
        for (StyledRun run : runs) {
            length += run.isLineBreak() ? 1 : run.getText().length();
        }
        return length;
    }
}
