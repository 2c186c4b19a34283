package quest.gekko.pulse.service.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.domain.ContentItem;
import quest.gekko.pulse.service.store.PipelineStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Normalises raw records in parallel, then folds them into the store one by one in input
 * order, so duplicates inside a single pass merge the same way as across passes.
 * A record the store refuses is counted as a store failure and the pass goes on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {
    private static final int CHUNK = 256;

    private final ContentNormalizer normalizer;
    private final PipelineStore store;
    private final Clock clock;
    @Qualifier("lexiconExecutor")
    private final Executor executor;

    public IngestOutcome ingest(List<RawContent> raws) {
        List<NormalizationResult> results = normalizeAll(raws);

        Map<RejectionReason, Integer> rejected = new EnumMap<>(RejectionReason.class);
        Map<String, ContentItem> touched = new LinkedHashMap<>();
        int created = 0, merged = 0, storeFailures = 0;
        Instant now = clock.instant();

        for (NormalizationResult result : results) {
            if (!result.isAccepted()) {
                rejected.merge(result.rejection(), 1, Integer::sum);
                continue;
            }
            ContentItem incoming = result.item();
            Optional<ContentItem> existing = Optional.ofNullable(touched.get(incoming.getId()))
                    .or(() -> store.getItem(incoming.getId()));
            ContentItem stored;
            try {
                if (existing.isPresent()) {
                    stored = store.putItem(normalizer.merge(existing.get(), incoming, now));
                    merged++;
                } else {
                    stored = store.putItem(incoming.toBuilder().ingestedAt(now).updatedAt(now).build());
                    created++;
                }
            } catch (DataAccessException e) {
                storeFailures++;
                log.warn("Could not store {} item {}: {}", incoming.getSource(), incoming.getId(), e.getMostSpecificCause().getMessage());
                continue;
            }
            touched.put(stored.getId(), stored);
        }

        int rejectedTotal = rejected.values().stream().mapToInt(Integer::intValue).sum();
        if (rejectedTotal > 0) {
            log.info("Rejected {} of {} raw records: {}", rejectedTotal, raws.size(), rejected);
        }
        if (storeFailures > 0) {
            log.warn("{} of {} accepted records could not be stored", storeFailures, raws.size() - rejectedTotal);
        }
        return new IngestOutcome(new ArrayList<>(touched.values()), raws.size(), created, merged, rejected, storeFailures);
    }

    private List<NormalizationResult> normalizeAll(List<RawContent> raws) {
        if (raws.size() <= CHUNK) {
            return raws.stream().map(normalizer::normalize).toList();
        }
        List<CompletableFuture<List<NormalizationResult>>> chunks = new ArrayList<>();
        for (int i = 0; i < raws.size(); i += CHUNK) {
            List<RawContent> chunk = raws.subList(i, Math.min(raws.size(), i + CHUNK));
            chunks.add(CompletableFuture.supplyAsync(() -> chunk.stream().map(normalizer::normalize).toList(), executor));
        }
        List<NormalizationResult> results = new ArrayList<>(raws.size());
        chunks.forEach(c -> results.addAll(c.join()));
        return results;
    }
}
