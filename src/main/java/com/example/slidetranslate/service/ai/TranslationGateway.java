package com.example.slidetranslate.service.ai;

import com.example.slidetranslate.config.TranslationSettings;
import com.example.slidetranslate.dto.translation.BatchItem;
import com.example.slidetranslate.dto.translation.BatchResult;
import com.example.slidetranslate.service.translation.GlossaryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a batch of encoded paragraphs into one backend exchange and back.
 * Never throws: a failed batch comes back as an empty list.
 */
@Service
public class TranslationGateway {

    private static final Logger logger = LoggerFactory.getLogger(TranslationGateway.class);

    static final String LINE_FORMAT_POLICY = """

        Input format: each line is "<id> ::: <max_chars> ::: <text>".
        Output format: for every input line, output exactly one line "<id> ::: <translation>".
        Keep the ids unchanged and output nothing else.
        The text uses style tags: <sz v="..."> <c v="..."> <b> <i> <u> <s>, and <sp/> for a space, <br/> for a line break.
        Keep every tag around the words it styles, keep <sp/> and <br/> tags, and do not add new tags.
        Keep each translation within its max_chars characters, not counting tags; shorten wording if needed.
        """;

    @Autowired
    private ChatBackendService backend;

    @Autowired
    private GlossaryService glossaryService;

    @Autowired
    private TranslationSettings settings;

    /**
     * Translate one batch.
     *
     * @param items batch items with batch-local ids
     * @param promptTemplate system prompt template with {@code {source_language}},
     *        {@code {target_language}} and {@code {max_chars}} placeholders
     * @return results keyed by the ids of {@code items}; empty when the backend failed
     */
    public List<BatchResult> translateBatch(List<BatchItem> items, String promptTemplate) {
        if (items.isEmpty()) {
            return new ArrayList<>();
        }

        String systemPrompt = buildSystemPrompt(items, promptTemplate);
        String payload = BatchProtocol.serialize(items);
        try {
            String response = backend.complete(systemPrompt, payload);
            List<BatchResult> results = BatchProtocol.parse(response);
            logger.debug("Batch of {} items returned {} lines", items.size(), results.size());
            return results;
        } catch (ContextLengthExceededException e) {
            if (settings.isSplitOnLengthError() && items.size() > 1) {
                int half = items.size() / 2;
                logger.warn("⚠️ Batch of {} items too long for the model, splitting in two", items.size());
                List<BatchResult> results = new ArrayList<>();
                results.addAll(translateBatch(new ArrayList<>(items.subList(0, half)), promptTemplate));
                results.addAll(translateBatch(new ArrayList<>(items.subList(half, items.size())), promptTemplate));
                return results;
            }
            logger.warn("⚠️ Batch of {} items dropped: {}", items.size(), e.getMessage());
            return new ArrayList<>();
        } catch (RuntimeException e) {
            logger.warn("⚠️ Batch of {} items dropped: {}", items.size(), e.getMessage());
            return new ArrayList<>();
        }
    }

    String buildSystemPrompt(List<BatchItem> items, String promptTemplate) {
        int maxChars = 0;
        for (BatchItem item : items) {
            maxChars = Math.max(maxChars, item.getLimit());
        }

        String template = promptTemplate == null ? "" : promptTemplate;
        StringBuilder prompt = new StringBuilder(template
            .replace("{source_language}", settings.getSourceLanguage())
            .replace("{target_language}", settings.getTargetLanguage())
            .replace("{max_chars}", String.valueOf(maxChars)));
        prompt.append(LINE_FORMAT_POLICY);

        Map<String, String> glossary = glossaryService.getGlossary();
        if (!glossary.isEmpty()) {
            prompt.append("\nGlossary:\n");
            for (Map.Entry<String, String> entry : glossary.entrySet()) {
                prompt.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
            }
        }
        return prompt.toString();
    }
}
