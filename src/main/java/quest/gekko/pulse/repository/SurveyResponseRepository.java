package quest.gekko.pulse.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.pulse.domain.SurveyResponse;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SurveyResponseRepository extends JpaRepository<SurveyResponse, Long> {
    Optional<SurveyResponse> findByRespondentIdAndTitleId(String respondentId, String titleId);

    @Query("""
        select r from SurveyResponse r
        where r.titleId = :titleId and r.submittedAt >= :from and r.submittedAt < :to
        order by r.respondentId
        """)
    List<SurveyResponse> findForTitle(@Param("titleId") String titleId,
                                      @Param("from") Instant from,
                                      @Param("to") Instant to);
}
