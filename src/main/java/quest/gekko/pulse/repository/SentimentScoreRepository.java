package quest.gekko.pulse.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.pulse.domain.ScoreId;
import quest.gekko.pulse.domain.SentimentScore;

import java.time.Instant;
import java.util.List;

public interface SentimentScoreRepository extends JpaRepository<SentimentScore, ScoreId> {

    @Query("""
        select s from SentimentScore s
        where s.titleId = :titleId and s.contentCreatedAt >= :from and s.contentCreatedAt < :to
        order by s.itemId, s.model
        """)
    List<SentimentScore> findForTitle(@Param("titleId") String titleId,
                                      @Param("from") Instant from,
                                      @Param("to") Instant to);
}
