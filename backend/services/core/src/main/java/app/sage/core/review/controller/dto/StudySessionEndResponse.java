package app.sage.core.review.controller.dto;

import java.time.Instant;
import java.util.UUID;

public record StudySessionEndResponse(
        UUID sessionId,
        boolean completed,
        Instant completedAt,
        int cardsStudied,
        int cardsCorrect,
        long timeSpentMs,
        int currentStreak,
        int longestStreak
) {}
