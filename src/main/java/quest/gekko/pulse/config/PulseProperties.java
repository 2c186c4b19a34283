package quest.gekko.pulse.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the pipeline and the admin surface.
 * Values are bound as-is here and validated by {@link PipelineSettings}.
 */
@Configuration
@EnableConfigurationProperties({
        PulseProperties.Pipeline.class,
        PulseProperties.Security.class
})
public class PulseProperties {

    @ConfigurationProperties("pulse")
    public record Pipeline(
            List<TrackedTitle> trackedTitles,
            @DefaultValue("lexicon") String sentimentModel,
            String aggregationModel,
            @DefaultValue("0.05") double positiveThreshold,
            @DefaultValue("-0.05") double negativeThreshold,
            @DefaultValue("0.0") double confidenceFloor,
            @DefaultValue("count-only") String lowConfidencePolicy,
            @DefaultValue("365") int retentionDays,
            @DefaultValue({"twitter", "reddit"}) List<String> platforms,
            @DefaultValue SurveyScale surveyScale,
            @DefaultValue Scoring scoring,
            @DefaultValue Transformer transformer,
            @DefaultValue Comparison comparison,
            @DefaultValue Schedule schedule) {}

    public record TrackedTitle(String id, String name, List<String> keywords) {}

    public record SurveyScale(@DefaultValue("1") int min, @DefaultValue("5") int max) {}

    public record Scoring(
            @DefaultValue("32") int batchSize,
            @DefaultValue("2") int maxInFlightBatches,
            @DefaultValue("4") int lexiconWorkers,
            @DefaultValue("2") int transformerWorkers,
            @DefaultValue("false") boolean fallbackOnTimeout) {}

    public record Transformer(
            String endpoint,
            @DefaultValue("distilbert-base-uncased-finetuned-sst-2-english") String modelName,
            String apiToken,
            @DefaultValue("512") int maxTokens,
            @DefaultValue("30s") Duration timeout,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("500ms") Duration backoff) {}

    public record Comparison(@DefaultValue("7") int windowDays, @DefaultValue("3") int minPairs) {}

    public record Schedule(@DefaultValue("false") boolean enabled, @DefaultValue("0 30 2 * * *") String cron) {}

    @ConfigurationProperties("security.admin")
    public record Security(@DefaultValue("admin") String username, String password) {}
}
