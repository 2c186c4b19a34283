package quest.gekko.pulse.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.pulse.domain.AggregateId;
import quest.gekko.pulse.domain.DailyAggregate;

import java.time.LocalDate;
import java.util.List;

public interface DailyAggregateRepository extends JpaRepository<DailyAggregate, AggregateId> {

    @Query("""
        select a from DailyAggregate a
        where a.titleId = :titleId and a.source = :source and a.date >= :from and a.date <= :to
        order by a.date
        """)
    List<DailyAggregate> findRange(@Param("titleId") String titleId,
                                   @Param("source") String source,
                                   @Param("from") LocalDate from,
                                   @Param("to") LocalDate to);
}
