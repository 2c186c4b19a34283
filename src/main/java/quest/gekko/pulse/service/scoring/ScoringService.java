package quest.gekko.pulse.service.scoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.config.PipelineSettings;
import quest.gekko.pulse.domain.ContentItem;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.domain.SentimentScore;
import quest.gekko.pulse.exception.PipelineConfigurationException;
import quest.gekko.pulse.exception.ScoringFailureException;
import quest.gekko.pulse.service.store.PipelineStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Scores content items with a given model and stores one row per (item, model).
 *
 * Batches run on a worker pool per model family. Transformer batches are additionally capped
 * by a semaphore so no more than {@code maxInFlightBatches} are held in memory at once.
 * A failed transformer batch is rescored by the lexicon and flagged as a fallback; a timed out
 * batch is left unscored for the next run unless {@code fallbackOnTimeout} is set.
 */
@Slf4j
@Service
public class ScoringService {
    private final PipelineStore store;
    private final Map<SentimentModel, SentimentScorer> scorers;
    private final PipelineSettings settings;
    private final Executor lexiconExecutor;
    private final Executor transformerExecutor;
    private final Clock clock;
    private final Semaphore inFlight;

    public ScoringService(PipelineStore store,
                          Map<SentimentModel, SentimentScorer> scorers,
                          PipelineSettings settings,
                          @Qualifier("lexiconExecutor") Executor lexiconExecutor,
                          @Qualifier("transformerExecutor") Executor transformerExecutor,
                          Clock clock) {
        this.store = store;
        this.scorers = scorers;
        this.settings = settings;
        this.lexiconExecutor = lexiconExecutor;
        this.transformerExecutor = transformerExecutor;
        this.clock = clock;
        this.inFlight = new Semaphore(settings.getMaxInFlightBatches());
    }

    /** Scores the items that have no row for {@code model} yet; the rest are skipped. */
    public ScoringOutcome scoreBatch(Collection<ContentItem> items, SentimentModel model) {
        List<ContentItem> distinct = distinct(items);
        List<ContentItem> pending = distinct.stream()
                .filter(i -> store.getScore(i.getId(), model).isEmpty())
                .toList();
        return run(pending, model).withSkipped(distinct.size() - pending.size());
    }

    /** Scores every item again and overwrites its row, e.g. after a model version change. */
    public ScoringOutcome rescore(Collection<ContentItem> items, SentimentModel model) {
        return run(distinct(items), model);
    }

    private ScoringOutcome run(List<ContentItem> items, SentimentModel model) {
        if (items.isEmpty()) return ScoringOutcome.empty();

        SentimentScorer scorer = scorerFor(model);
        boolean bounded = model != SentimentModel.LEXICON;
        Executor executor = bounded ? transformerExecutor : lexiconExecutor;
        List<List<ContentItem>> batches = partition(items, settings.getBatchSize());

        List<CompletableFuture<ScoringOutcome>> futures = new ArrayList<>(batches.size());
        List<Integer> sizes = new ArrayList<>(batches.size());
        ScoringOutcome total = ScoringOutcome.empty();

        for (int b = 0; b < batches.size(); b++) {
            List<ContentItem> batch = batches.get(b);
            if (Thread.currentThread().isInterrupted() || bounded && !acquire()) {
                int left = remaining(batches, b);
                log.warn("Scoring interrupted, {} items left for the next run", left);
                total = total.withDeferred(left);
                break;
            }
            CompletableFuture<ScoringOutcome> future;
            try {
                future = CompletableFuture.supplyAsync(() -> scoreOne(batch, scorer, model), executor);
            } catch (RejectedExecutionException e) {
                if (bounded) inFlight.release();
                int left = remaining(batches, b);
                log.warn("Worker pool rejected scoring work, {} items left for the next run", left, e);
                total = total.withDeferred(left);
                break;
            }
            if (bounded) {
                future = future.whenComplete((r, t) -> inFlight.release());
            }
            futures.add(future);
            sizes.add(batch.size());
        }

        for (int i = 0; i < futures.size(); i++) {
            try {
                total = total.plus(futures.get(i).join());
            } catch (CompletionException e) {
                log.error("Scoring batch of {} items failed unexpectedly, left for the next run", sizes.get(i), e.getCause());
                total = total.withDeferred(sizes.get(i));
            }
        }
        return total;
    }

    private ScoringOutcome scoreOne(List<ContentItem> batch, SentimentScorer scorer, SentimentModel model) {
        List<String> texts = batch.stream().map(ContentItem::getText).toList();
        try {
            List<Polarity> polarities = scorer.scoreBatch(texts);
            int written = persist(batch, polarities, model, model);
            return ScoringOutcome.scored(model, written).withDeferred(batch.size() - written);
        } catch (ScoringFailureException e) {
            if (e.isTimeout() && !settings.isFallbackOnTimeout()) {
                log.warn("{} batch of {} items timed out, deferred: {}", model, batch.size(), e.getMessage());
                return ScoringOutcome.empty().withFailures(batch.size()).withDeferred(batch.size());
            }
            log.warn("{} batch of {} items failed, falling back to {}: {}",
                    model, batch.size(), SentimentModel.LEXICON, e.getMessage());
            SentimentScorer lexicon = scorerFor(SentimentModel.LEXICON);
            List<Polarity> polarities = lexicon.scoreBatch(texts);
            int written = persist(batch, polarities, SentimentModel.LEXICON, model);
            return ScoringOutcome.scored(SentimentModel.LEXICON, written)
                    .withFailures(batch.size())
                    .withFallbacks(written)
                    .withDeferred(batch.size() - written);
        }
    }

    private int persist(List<ContentItem> batch, List<Polarity> polarities, SentimentModel produced, SentimentModel requested) {
        Instant now = clock.instant();
        int written = 0;
        try {
            for (int i = 0; i < batch.size(); i++) {
                ContentItem item = batch.get(i);
                Polarity p = polarities.get(i);
                store.putScore(SentimentScore.builder()
                        .itemId(item.getId())
                        .model(produced)
                        .requestedModel(requested)
                        .polarity(p.polarity())
                        .confidence(p.confidence())
                        .computedAt(now)
                        .titleId(item.getTitleId())
                        .source(item.getSource())
                        .contentCreatedAt(item.getCreatedAt())
                        .build());
                written++;
            }
        } catch (RuntimeException e) {
            log.error("Storing scores failed after {} of {} rows, the rest are left for the next run",
                    written, batch.size(), e);
        }
        return written;
    }

    private SentimentScorer scorerFor(SentimentModel model) {
        SentimentScorer scorer = scorers.get(model);
        if (scorer == null) {
            throw new PipelineConfigurationException("No scorer registered for model " + model);
        }
        return scorer;
    }

    private boolean acquire() {
        try {
            inFlight.acquire();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static int remaining(List<List<ContentItem>> batches, int from) {
        int n = 0;
        for (int i = from; i < batches.size(); i++) n += batches.get(i).size();
        return n;
    }

    private static List<ContentItem> distinct(Collection<ContentItem> items) {
        Map<String, ContentItem> byId = new LinkedHashMap<>();
        items.forEach(i -> byId.putIfAbsent(i.getId(), i));
        return new ArrayList<>(byId.values());
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> parts = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            parts.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
        }
        return parts;
    }
}
