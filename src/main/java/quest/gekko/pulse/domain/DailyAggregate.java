package quest.gekko.pulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Cached view of one (title, source, day) bucket. Rebuilt wholesale on every recompute,
 * so it carries nothing that is not derivable from scores and survey responses.
 */
@Entity
@Table(name = "daily_aggregate")
@IdClass(AggregateId.class)
@Getter @Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DailyAggregate {
    @Id @Column(name = "title_id")
    String titleId;

    @Id @Column(length = 32)
    String source;

    @Id @Column(name = "bucket_date")
    LocalDate date;

    /** Model the social rows were read for; null on survey buckets. */
    @Enumerated(EnumType.STRING) @Column(length = 16)
    SentimentModel model;

    @Column(name = "item_count", nullable = false)
    int count;

    /** Rows the mean and stddev were taken over; zero means the mean is not a measurement. */
    @Column(nullable = false)
    int meanCount;

    @Column(nullable = false)
    double meanPolarity;

    @Column(nullable = false)
    double stddevPolarity;

    @Column(nullable = false)
    int positiveCount;

    @Column(nullable = false)
    int neutralCount;

    @Column(nullable = false)
    int negativeCount;

    /** Rows under the confidence floor, whatever the policy did with them. */
    @Column(nullable = false)
    int lowConfidenceCount;

    /** Rows produced by the lexicon in place of a failed transformer call. */
    @Column(nullable = false)
    int fallbackCount;

    // survey buckets only
    Double meanSatisfaction;
    Double recommendationRate;
    Double meanCompletionRate;

    public static DailyAggregate empty(String titleId, String source, LocalDate date, SentimentModel model) {
        return DailyAggregate.builder()
                .titleId(titleId)
                .source(source)
                .date(date)
                .model(model)
                .build();
    }
}
