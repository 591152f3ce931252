package app.sage.core.review.repository;

import app.sage.core.review.entity.ReviewLogEntity;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.UUID;

@org.springframework.stereotype.Repository
public interface ReviewStatsRepository extends Repository<ReviewLogEntity, Long> {

    interface ActivityProjection {
        long getReviewCount();

        long getAgainCount();

        long getHardCount();

        long getGoodCount();

        long getEasyCount();

        long getTotalReviewTimeMs();
    }

    interface SnapshotProjection {
        long getTotalCards();

        long getTrackedCards();

        long getDueNow();

        long getDueTomorrow();

        long getLearningCards();

        long getMasteredCards();
    }

    @Query(value = """
            select
                count(*) as review_count,
                count(*) filter (where l.rating = 1) as again_count,
                count(*) filter (where l.rating = 2) as hard_count,
                count(*) filter (where l.rating = 3) as good_count,
                count(*) filter (where l.rating = 4) as easy_count,
                coalesce(sum(l.review_time_ms), 0) as total_review_time_ms
            from app_core.review_logs l
            join app_core.cards c on c.card_id = l.card_id
            where l.user_id = :userId
              and c.is_deleted = false
              and (cast(:deckId as uuid) is null or c.deck_id = cast(:deckId as uuid))
              and l.reviewed_at >= :fromInstant
              and l.reviewed_at < :toInstant
            """, nativeQuery = true)
    ActivityProjection loadActivity(@Param("userId") UUID userId,
                                    @Param("deckId") UUID deckId,
                                    @Param("fromInstant") Instant fromInstant,
                                    @Param("toInstant") Instant toInstant);

    @Query(value = """
            select
                count(*) as total_cards,
                count(s.card_id) as tracked_cards,
                count(*) filter (where s.due <= :now) as due_now,
                count(*) filter (where s.due >= :tomorrowStart and s.due < :tomorrowEnd) as due_tomorrow,
                count(*) filter (where s.card_id is not null and s.stability <= :masteredStability) as learning_cards,
                count(*) filter (where s.phase = 'REVIEW' and s.stability > :masteredStability) as mastered_cards
            from app_core.cards c
            left join app_core.card_states s on s.card_id = c.card_id and s.user_id = :userId
            where c.user_id = :userId
              and c.is_deleted = false
              and (cast(:deckId as uuid) is null or c.deck_id = cast(:deckId as uuid))
            """, nativeQuery = true)
    SnapshotProjection loadSnapshot(@Param("userId") UUID userId,
                                    @Param("deckId") UUID deckId,
                                    @Param("now") Instant now,
                                    @Param("tomorrowStart") Instant tomorrowStart,
                                    @Param("tomorrowEnd") Instant tomorrowEnd,
                                    @Param("masteredStability") double masteredStability);
}
