package quest.gekko.pulse.config;

import lombok.Builder;
import lombok.Getter;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.domain.Sources;
import quest.gekko.pulse.domain.Title;
import quest.gekko.pulse.exception.PipelineConfigurationException;
import quest.gekko.pulse.service.aggregation.LowConfidencePolicy;
import quest.gekko.pulse.util.Slug;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Validated, immutable view of {@link PulseProperties.Pipeline}. Built once at startup;
 * any inconsistency fails the context with a {@link PipelineConfigurationException}.
 */
@Getter
@Builder(toBuilder = true)
public class PipelineSettings {

    private final List<Title> titles;

    @Builder.Default
    private final SentimentModel sentimentModel = SentimentModel.LEXICON;

    private final SentimentModel aggregationModel;

    @Builder.Default
    private final double positiveThreshold = 0.05;
    @Builder.Default
    private final double negativeThreshold = -0.05;
    @Builder.Default
    private final double confidenceFloor = 0.0;
    @Builder.Default
    private final LowConfidencePolicy lowConfidencePolicy = LowConfidencePolicy.COUNT_ONLY;

    @Builder.Default
    private final int retentionDays = 365;
    @Builder.Default
    private final List<String> platforms = List.of("twitter", "reddit");

    @Builder.Default
    private final int surveyScaleMin = 1;
    @Builder.Default
    private final int surveyScaleMax = 5;

    @Builder.Default
    private final int batchSize = 32;
    @Builder.Default
    private final int maxInFlightBatches = 2;
    @Builder.Default
    private final int lexiconWorkers = 4;
    @Builder.Default
    private final int transformerWorkers = 2;
    @Builder.Default
    private final boolean fallbackOnTimeout = false;

    @Builder.Default
    private final int windowDays = 7;
    @Builder.Default
    private final int minPairs = 3;

    /** Aggregates read the sentiment model's rows unless told otherwise. */
    public SentimentModel getAggregationModel() {
        return aggregationModel == null ? sentimentModel : aggregationModel;
    }

    public static PipelineSettings from(PulseProperties.Pipeline p) {
        List<Title> titles = new ArrayList<>();
        if (p.trackedTitles() != null) {
            for (PulseProperties.TrackedTitle t : p.trackedTitles()) {
                titles.add(toTitle(t));
            }
        }
        return PipelineSettings.builder()
                .titles(titles)
                .sentimentModel(SentimentModel.parse(p.sentimentModel()))
                .aggregationModel(p.aggregationModel() == null || p.aggregationModel().isBlank()
                        ? null : SentimentModel.parse(p.aggregationModel()))
                .positiveThreshold(p.positiveThreshold())
                .negativeThreshold(p.negativeThreshold())
                .confidenceFloor(p.confidenceFloor())
                .lowConfidencePolicy(LowConfidencePolicy.parse(p.lowConfidencePolicy()))
                .retentionDays(p.retentionDays())
                .platforms(p.platforms().stream().map(Sources::normalize).toList())
                .surveyScaleMin(p.surveyScale().min())
                .surveyScaleMax(p.surveyScale().max())
                .batchSize(p.scoring().batchSize())
                .maxInFlightBatches(p.scoring().maxInFlightBatches())
                .lexiconWorkers(p.scoring().lexiconWorkers())
                .transformerWorkers(p.scoring().transformerWorkers())
                .fallbackOnTimeout(p.scoring().fallbackOnTimeout())
                .windowDays(p.comparison().windowDays())
                .minPairs(p.comparison().minPairs())
                .build()
                .validate();
    }

    private static Title toTitle(PulseProperties.TrackedTitle t) {
        if (t.name() == null || t.name().isBlank()) {
            throw new PipelineConfigurationException("Tracked title without a name: " + t);
        }
        String id = t.id() == null || t.id().isBlank() ? Slug.of(t.name()) : t.id().trim();
        Set<String> keywords = new LinkedHashSet<>();
        keywords.add(t.name().trim().toLowerCase(Locale.ROOT));
        if (t.keywords() != null) {
            t.keywords().stream()
                    .filter(k -> k != null && !k.isBlank())
                    .map(k -> k.trim().toLowerCase(Locale.ROOT))
                    .forEach(keywords::add);
        }
        return new Title(id, t.name().trim(), keywords);
    }

    public PipelineSettings validate() {
        if (titles == null || titles.isEmpty()) {
            throw new PipelineConfigurationException("pulse.tracked-titles must list at least one title");
        }
        Set<String> ids = new HashSet<>();
        for (Title t : titles) {
            if (t.id() == null || t.id().isBlank()) {
                throw new PipelineConfigurationException("Title without id: " + t.name());
            }
            if (!ids.add(t.id())) {
                throw new PipelineConfigurationException("Duplicate title id: " + t.id());
            }
            if (t.keywords().isEmpty()) {
                throw new PipelineConfigurationException("Title has no keywords: " + t.id());
            }
        }
        if (sentimentModel == null) {
            throw new PipelineConfigurationException("pulse.sentiment-model is required");
        }
        requireRange("positive-threshold", positiveThreshold, -1, 1);
        requireRange("negative-threshold", negativeThreshold, -1, 1);
        if (negativeThreshold >= positiveThreshold) {
            throw new PipelineConfigurationException("negative-threshold (" + negativeThreshold
                    + ") must be below positive-threshold (" + positiveThreshold + ")");
        }
        requireRange("confidence-floor", confidenceFloor, 0, 1);
        if (lowConfidencePolicy == null) {
            throw new PipelineConfigurationException("pulse.low-confidence-policy is required");
        }
        if (retentionDays <= 0) {
            throw new PipelineConfigurationException("retention-days must be positive");
        }
        for (String platform : platforms) {
            if (!Sources.isPlatform(platform)) {
                throw new PipelineConfigurationException("Invalid platform tag: " + platform);
            }
        }
        if (surveyScaleMin >= surveyScaleMax) {
            throw new PipelineConfigurationException("survey-scale.min must be below survey-scale.max");
        }
        requirePositive("scoring.batch-size", batchSize);
        requirePositive("scoring.max-in-flight-batches", maxInFlightBatches);
        requirePositive("scoring.lexicon-workers", lexiconWorkers);
        requirePositive("scoring.transformer-workers", transformerWorkers);
        requirePositive("comparison.window-days", windowDays);
        if (minPairs < 2) {
            throw new PipelineConfigurationException("comparison.min-pairs must be at least 2");
        }
        return this;
    }

    private static void requireRange(String name, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new PipelineConfigurationException(name + " must be within [" + min + ", " + max + "], was " + value);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new PipelineConfigurationException(name + " must be positive, was " + value);
        }
    }
}
