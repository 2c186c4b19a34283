package quest.gekko.pulse.service.ingest;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import quest.gekko.pulse.domain.ContentItem;
import quest.gekko.pulse.service.store.InMemoryPipelineStore;
import quest.gekko.pulse.service.store.PipelineStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static quest.gekko.pulse.Fixtures.CLOCK;
import static quest.gekko.pulse.Fixtures.NOW;
import static quest.gekko.pulse.Fixtures.raw;
import static quest.gekko.pulse.Fixtures.registry;

class IngestionServiceTest {

    private static final Instant AT = Instant.parse("2024-01-05T10:00:00Z");

    @Test
    void largeBatchesAreNormalisedInParallelAndMergedInOrder() {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            InMemoryPipelineStore store = new InMemoryPipelineStore();
            IngestionService ingestion = new IngestionService(new ContentNormalizer(registry()), store, CLOCK, pool);
            List<RawContent> raws = new ArrayList<>();
            for (int i = 0; i < 600; i++) {
                // every id appears twice
                raws.add(new RawContent("twitter", "id-" + (i % 300), null, "Wednesday post " + i, "u", AT, (long) i));
            }

            IngestOutcome outcome = ingestion.ingest(raws);

            assertThat(outcome.received()).isEqualTo(600);
            assertThat(outcome.created()).isEqualTo(300);
            assertThat(outcome.merged()).isEqualTo(300);
            assertThat(outcome.items()).hasSize(300);
            // last write wins on engagement
            assertThat(outcome.items().get(0).getEngagement()).isEqualTo(300L);
            assertThat(outcome.items().get(0).getText()).isEqualTo("Wednesday post 0");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rejectionsAreCountedNotStored() {
        InMemoryPipelineStore store = new InMemoryPipelineStore();
        IngestionService ingestion = new IngestionService(new ContentNormalizer(registry()), store, CLOCK, Runnable::run);

        IngestOutcome outcome = ingestion.ingest(List.of(
                raw("twitter", "1", "Wednesday", AT),
                raw("twitter", "2", "no match", AT),
                raw("twitter", "3", "no match either", AT)));

        assertThat(outcome.rejected()).containsEntry(RejectionReason.NO_TITLE_MATCH, 2);
        assertThat(outcome.rejectedTotal()).isEqualTo(2);
        assertThat(store.getItems("wednesday", AT, AT.plusSeconds(1))).hasSize(1)
                .allSatisfy(i -> assertThat(i.getIngestedAt()).isEqualTo(NOW));
    }

    @Test
    void aRecordTheStoreRefusesIsCountedAndTheRestAreKept() {
        InMemoryPipelineStore backing = new InMemoryPipelineStore();
        PipelineStore store = mock(PipelineStore.class);
        doAnswer(inv -> backing.getItem(inv.getArgument(0))).when(store).getItem(any());
        doAnswer(inv -> backing.putItem(inv.getArgument(0))).when(store).putItem(any());
        doThrow(new DataIntegrityViolationException("Value too long for column"))
                .when(store).putItem(argThat((ContentItem i) -> "reddit".equals(i.getSource())));
        IngestionService ingestion = new IngestionService(new ContentNormalizer(registry()), store, CLOCK, Runnable::run);

        IngestOutcome outcome = ingestion.ingest(List.of(
                raw("twitter", "1", "Wednesday is great", AT),
                raw("reddit", "2", "Wednesday essay", AT),
                raw("twitter", "3", "Nevermore again", AT)));

        assertThat(outcome.created()).isEqualTo(2);
        assertThat(outcome.storeFailures()).isEqualTo(1);
        assertThat(outcome.items()).extracting(ContentItem::getSource).containsExactly("twitter", "twitter");
        assertThat(backing.getItems("wednesday", AT, AT.plusSeconds(1))).hasSize(2);
    }
}
