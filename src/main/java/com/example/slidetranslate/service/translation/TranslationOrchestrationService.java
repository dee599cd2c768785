package com.example.slidetranslate.service.translation;

import com.example.slidetranslate.config.TranslationSettings;
import com.example.slidetranslate.deck.DeckShape;
import com.example.slidetranslate.deck.DeckSlide;
import com.example.slidetranslate.deck.SlideDeck;
import com.example.slidetranslate.dto.translation.BatchItem;
import com.example.slidetranslate.dto.translation.BatchResult;
import com.example.slidetranslate.dto.translation.TextContext;
import com.example.slidetranslate.dto.translation.TranslationSummary;
import com.example.slidetranslate.dto.translation.TranslationTask;
import com.example.slidetranslate.service.ai.TranslationGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Translation pass over a whole deck.
 *
 * <p>Per slide the paragraphs are split by context, chunked into batches and sent to
 * the backend in parallel on the {@code translationExecutor}. Results are applied on
 * the calling thread in batch order, so the document is only ever touched by one
 * thread.
 */
@Service
public class TranslationOrchestrationService {

    private static final Logger logger = LoggerFactory.getLogger(TranslationOrchestrationService.class);

    @Autowired
    private DocumentWalker walker;

    @Autowired
    private TranslationGateway gateway;

    @Autowired
    private ParagraphReconstructor reconstructor;

    @Autowired
    private CharacterBudgetCalculator budget;

    @Autowired
    private TranslationSettings settings;

    @Autowired
    @Qualifier("translationExecutor")
    private Executor executor;

    public TranslationSummary translateDeck(SlideDeck deck) {
        TranslationSummary summary = new TranslationSummary();
        List<DeckSlide> slides = deck.getSlides();
        summary.setSlides(slides.size());

        for (DeckSlide slide : slides) {
            List<TranslationTask> tasks = collectTasks(slide);
            logger.info("Slide {}/{}: {} paragraphs", slide.getNumber(), slides.size(), tasks.size());
            summary.setParagraphs(summary.getParagraphs() + tasks.size());
            if (tasks.isEmpty()) {
                continue;
            }
            translateSlide(tasks, summary);
        }

        logger.info("✅ Translated {} of {} paragraphs on {} slides ({} batches, {} came back empty)",
            summary.getTranslated(), summary.getParagraphs(), summary.getSlides(),
            summary.getBatches(), summary.getEmptyBatches());
        return summary;
    }

    List<TranslationTask> collectTasks(DeckSlide slide) {
        List<TranslationTask> tasks = new ArrayList<>();
        for (DeckShape shape : slide.getShapes()) {
            tasks.addAll(walker.walk(shape, TextContext.STANDARD));
        }
        for (TranslationTask task : tasks) {
            task.setMaxChars(budget.maxChars(task.getRawLength()));
        }
        return tasks;
    }

    private void translateSlide(List<TranslationTask> tasks, TranslationSummary summary) {
        List<TranslationTask> standard = new ArrayList<>();
        List<TranslationTask> constrained = new ArrayList<>();
        for (TranslationTask task : tasks) {
            if (task.getContext() == TextContext.CONSTRAINED) {
                constrained.add(task);
            } else {
                standard.add(task);
            }
        }

        List<List<TranslationTask>> batches = new ArrayList<>();
        List<CompletableFuture<List<BatchResult>>> futures = new ArrayList<>();
        submitBatches(standard, settings.getPresentationBodyPrompt(), batches, futures);
        submitBatches(constrained, settings.getConstrainedTextPrompt(), batches, futures);

        for (int i = 0; i < batches.size(); i++) {
            List<BatchResult> results;
            try {
                results = futures.get(i).join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.warn("⚠️ Batch {}/{} failed: {}", i + 1, batches.size(), cause.getMessage());
                results = new ArrayList<>();
            }
            summary.setBatches(summary.getBatches() + 1);
            if (results.isEmpty()) {
                logger.warn("⚠️ Batch {}/{} returned no translations, {} paragraphs keep their original text",
                    i + 1, batches.size(), batches.get(i).size());
                summary.setEmptyBatches(summary.getEmptyBatches() + 1);
            }
            reconcile(batches.get(i), results, summary);
            logger.debug("Batch {}/{} applied ({} results)", i + 1, batches.size(), results.size());
        }
    }

    private void submitBatches(List<TranslationTask> tasks, String promptTemplate,
                               List<List<TranslationTask>> batches,
                               List<CompletableFuture<List<BatchResult>>> futures) {
        int batchSize = settings.getBatchSize();
        for (int start = 0; start < tasks.size(); start += batchSize) {
            List<TranslationTask> batch = new ArrayList<>(tasks.subList(start, Math.min(start + batchSize, tasks.size())));
            List<BatchItem> items = new ArrayList<>(batch.size());
            for (int id = 0; id < batch.size(); id++) {
                TranslationTask task = batch.get(id);
                items.add(new BatchItem(id, task.getEncodedMarkup(), task.getMaxChars()));
            }
            batches.add(batch);
            futures.add(CompletableFuture.supplyAsync(() -> gateway.translateBatch(items, promptTemplate), executor));
        }
    }

    /**
     * Applies results to the batch's paragraphs by id. Missing ids leave their paragraph
     * untouched; ids outside the batch are ignored; for a repeated id the first line wins.
     */
    void reconcile(List<TranslationTask> batch, List<BatchResult> results, TranslationSummary summary) {
        Map<Integer, String> byId = new HashMap<>();
        for (BatchResult result : results) {
            byId.putIfAbsent(result.getId(), result.getTranslation());
        }

        for (int id = 0; id < batch.size(); id++) {
            String translation = byId.get(id);
            if (translation == null) {
                if (!results.isEmpty()) {
                    logger.warn("⚠️ No translation returned for item {}, keeping original text", id);
                }
                summary.addSkipped(1);
                continue;
            }
            try {
                if (reconstructor.apply(batch.get(id), translation)) {
                    summary.addTranslated(1);
                } else {
                    summary.addSkipped(1);
                }
            } catch (RuntimeException e) {
                logger.warn("⚠️ Cannot write translation of item {}: {}", id, e.getMessage());
                summary.addSkipped(1);
            }
        }
    }
}
