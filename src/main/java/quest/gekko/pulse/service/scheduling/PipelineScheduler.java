package quest.gekko.pulse.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.service.pipeline.PipelineService;
import quest.gekko.pulse.service.pipeline.RunSummary;

/**
 * Nightly trigger for {@link PipelineService#runCollectors()}. Holds no pipeline logic, so an
 * external orchestrator can call the admin endpoints instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pulse.schedule.enabled", havingValue = "true")
public class PipelineScheduler {
    private final PipelineService pipeline;

    // 02:30 UTC daily unless overridden
    @Scheduled(cron = "${pulse.schedule.cron:0 30 2 * * *}", zone = "UTC")
    public void runNightly() {
        try {
            RunSummary summary = pipeline.runCollectors();
            if (summary.isFailed()) {
                log.error("Nightly run {} left {} buckets unaggregated: {}",
                        summary.getRunId(), summary.getAggregationFailures(), summary.getFailedBuckets());
            }
        } catch (RuntimeException e) {
            log.error("Nightly pipeline run failed", e);
        }
    }
}
