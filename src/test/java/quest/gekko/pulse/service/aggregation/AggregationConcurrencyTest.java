package quest.gekko.pulse.service.aggregation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import quest.gekko.pulse.domain.DailyAggregate;
import quest.gekko.pulse.service.store.PipelineStore;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static quest.gekko.pulse.Fixtures.CLOCK;
import static quest.gekko.pulse.Fixtures.registry;
import static quest.gekko.pulse.Fixtures.settings;

class AggregationConcurrencyTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 5);

    private final PipelineStore store = mock(PipelineStore.class);
    private final ExecutorService callers = Executors.newFixedThreadPool(2);
    private final AtomicInteger inside = new AtomicInteger();
    private final AtomicInteger maxInside = new AtomicInteger();
    private final AtomicInteger reads = new AtomicInteger();

    private AggregationService aggregation;

    @BeforeEach
    void setUp() {
        doAnswer(inv -> inv.getArgument(0)).when(store).putAggregate(any(DailyAggregate.class));
        aggregation = new AggregationService(store, registry(), settings(), CLOCK,
                new ConcurrentMapCacheManager("aggregates", "alignment"), Runnable::run);
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
    }

    private void enter() {
        reads.incrementAndGet();
        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
    }

    @Test
    void recomputesOfTheSameBucketNeverOverlap() throws Exception {
        CountDownLatch firstInside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(store.getScores(any(), any(), any())).thenAnswer(inv -> {
            enter();
            try {
                firstInside.countDown();
                release.await(5, TimeUnit.SECONDS);
                return List.of();
            } finally {
                inside.decrementAndGet();
            }
        });

        Future<DailyAggregate> first = callers.submit(() -> aggregation.aggregate("wednesday", "twitter", DAY));
        assertThat(firstInside.await(5, TimeUnit.SECONDS)).isTrue();
        Future<DailyAggregate> second = callers.submit(() -> aggregation.aggregate("wednesday", "twitter", DAY));

        // the second caller is parked on the bucket lock while the first one holds it
        Thread.sleep(200);
        assertThat(reads.get()).isEqualTo(1);

        release.countDown();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);

        assertThat(reads.get()).isEqualTo(2);
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void recomputesOfDifferentBucketsRunSideBySide() throws Exception {
        CountDownLatch bothInside = new CountDownLatch(2);
        AtomicInteger metInside = new AtomicInteger();
        when(store.getScores(any(), any(), any())).thenAnswer(inv -> {
            enter();
            try {
                bothInside.countDown();
                if (bothInside.await(5, TimeUnit.SECONDS)) metInside.incrementAndGet();
                return List.of();
            } finally {
                inside.decrementAndGet();
            }
        });

        Future<DailyAggregate> wednesday = callers.submit(() -> aggregation.aggregate("wednesday", "twitter", DAY));
        Future<DailyAggregate> dark = callers.submit(() -> aggregation.aggregate("dark", "twitter", DAY));
        wednesday.get(10, TimeUnit.SECONDS);
        dark.get(10, TimeUnit.SECONDS);

        assertThat(metInside.get()).isEqualTo(2);
        assertThat(maxInside.get()).isEqualTo(2);
    }
}
