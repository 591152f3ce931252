package app.sage.core.review.controller.dto;

import app.sage.core.review.domain.Rating;

import java.util.Map;
import java.util.UUID;

public record StudyStatsResponse(
        UUID deckId,
        String timeZone,
        long reviewedToday,
        long studyTimeTodayMs,
        Map<Rating, Long> ratingsToday,
        long dueToday,
        long dueTomorrow,
        long totalCards,
        long newCards,
        long learningCards,
        long masteredCards,
        int streak,
        int longestStreak
) {}
