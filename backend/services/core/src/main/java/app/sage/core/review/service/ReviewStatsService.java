package app.sage.core.review.service;

import app.sage.core.review.controller.dto.StudyStatsResponse;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.StudyStreak;
import app.sage.core.review.entity.StudyStreakEntity;
import app.sage.core.review.repository.ReviewStatsRepository;
import app.sage.core.review.repository.StudyStreakRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

@Service
public class ReviewStatsService {

    static final double MASTERED_STABILITY_DAYS = 21.0;

    private final ReviewStatsRepository statsRepository;
    private final StudyStreakRepository streakRepository;
    private final Clock clock;

    public ReviewStatsService(ReviewStatsRepository statsRepository,
                              StudyStreakRepository streakRepository,
                              Clock clock) {
        this.statsRepository = statsRepository;
        this.streakRepository = streakRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public StudyStatsResponse stats(UUID userId, UUID deckId, String timeZone) {
        Instant now = clock.instant();
        ZoneId zone = StudyZones.resolve(timeZone);

        LocalDate today = LocalDate.ofInstant(now, zone);
        Instant todayStart = today.atStartOfDay(zone).toInstant();
        Instant tomorrowStart = today.plusDays(1).atStartOfDay(zone).toInstant();
        Instant tomorrowEnd = today.plusDays(2).atStartOfDay(zone).toInstant();

        ReviewStatsRepository.ActivityProjection activity =
                statsRepository.loadActivity(userId, deckId, todayStart, tomorrowStart);
        ReviewStatsRepository.SnapshotProjection snapshot =
                statsRepository.loadSnapshot(userId, deckId, now, tomorrowStart, tomorrowEnd, MASTERED_STABILITY_DAYS);

        Map<Rating, Long> ratings = new EnumMap<>(Rating.class);
        ratings.put(Rating.AGAIN, activity == null ? 0L : activity.getAgainCount());
        ratings.put(Rating.HARD, activity == null ? 0L : activity.getHardCount());
        ratings.put(Rating.GOOD, activity == null ? 0L : activity.getGoodCount());
        ratings.put(Rating.EASY, activity == null ? 0L : activity.getEasyCount());

        StudyStreak streak = streakRepository.findById(userId)
                .map(StudyStreakEntity::toDomain)
                .orElse(StudyStreak.NONE);

        long totalCards = snapshot == null ? 0L : snapshot.getTotalCards();
        long trackedCards = snapshot == null ? 0L : snapshot.getTrackedCards();

        return new StudyStatsResponse(
                deckId,
                zone.getId(),
                activity == null ? 0L : activity.getReviewCount(),
                activity == null ? 0L : activity.getTotalReviewTimeMs(),
                ratings,
                snapshot == null ? 0L : snapshot.getDueNow(),
                snapshot == null ? 0L : snapshot.getDueTomorrow(),
                totalCards,
                Math.max(0L, totalCards - trackedCards),
                snapshot == null ? 0L : snapshot.getLearningCards(),
                snapshot == null ? 0L : snapshot.getMasteredCards(),
                streak.currentAsOf(today),
                streak.longest()
        );
    }
}
