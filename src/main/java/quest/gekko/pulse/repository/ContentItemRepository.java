package quest.gekko.pulse.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.pulse.domain.ContentItem;
import quest.gekko.pulse.domain.SentimentModel;

import java.time.Instant;
import java.util.List;

public interface ContentItemRepository extends JpaRepository<ContentItem, String> {

    @Query("""
        select c from ContentItem c
        where c.titleId = :titleId and c.createdAt >= :from and c.createdAt < :to
        order by c.createdAt, c.id
        """)
    List<ContentItem> findForTitle(@Param("titleId") String titleId,
                                   @Param("from") Instant from,
                                   @Param("to") Instant to);

    @Query("""
        select c from ContentItem c
        where not exists (
            select s from SentimentScore s where s.itemId = c.id and s.model = :model)
        order by c.createdAt, c.id
        """)
    List<ContentItem> findUnscored(@Param("model") SentimentModel model, Pageable page);
}
