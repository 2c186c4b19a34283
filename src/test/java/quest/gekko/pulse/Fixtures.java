package quest.gekko.pulse;

import quest.gekko.pulse.config.PipelineSettings;
import quest.gekko.pulse.domain.ContentItem;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.domain.SentimentScore;
import quest.gekko.pulse.domain.SurveyResponse;
import quest.gekko.pulse.domain.Title;
import quest.gekko.pulse.service.ingest.RawContent;
import quest.gekko.pulse.service.ingest.TitleRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

/** Shared test data: two tracked titles and a clock frozen on 2024-01-10. */
public final class Fixtures {
    public static final Instant NOW = Instant.parse("2024-01-10T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    public static final Title WEDNESDAY = new Title("wednesday", "Wednesday", Set.of("wednesday", "nevermore"));
    public static final Title DARK = new Title("dark", "Dark", Set.of("dark", "winden"));

    private Fixtures() {}

    public static PipelineSettings settings() {
        return PipelineSettings.builder()
                .titles(List.of(WEDNESDAY, DARK))
                .build()
                .validate();
    }

    public static TitleRegistry registry() {
        return new TitleRegistry(List.of(WEDNESDAY, DARK));
    }

    public static RawContent raw(String source, String externalId, String text, Instant createdAt) {
        return new RawContent(source, externalId, null, text, "someone", createdAt, 1L);
    }

    public static ContentItem item(String id, String titleId, String source, String text, Instant createdAt) {
        return ContentItem.builder()
                .id(id)
                .source(source)
                .titleId(titleId)
                .text(text)
                .author("someone")
                .createdAt(createdAt)
                .ingestedAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static SentimentScore score(ContentItem item, SentimentModel model, double polarity, double confidence) {
        return SentimentScore.builder()
                .itemId(item.getId())
                .model(model)
                .requestedModel(model)
                .polarity(polarity)
                .confidence(confidence)
                .computedAt(NOW)
                .titleId(item.getTitleId())
                .source(item.getSource())
                .contentCreatedAt(item.getCreatedAt())
                .build();
    }

    public static SurveyResponse response(String respondentId, String titleId, int satisfaction, Instant submittedAt) {
        return SurveyResponse.builder()
                .respondentId(respondentId)
                .titleId(titleId)
                .satisfaction(satisfaction)
                .submittedAt(submittedAt)
                .build();
    }
}
