package app.sage.core.review.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * One applied rating. Written once after the state upsert and never fed back into scheduling.
 */
public record ReviewLogEntry(
        UUID cardId,
        UUID userId,
        Rating rating,
        CardPhase phaseBefore,
        CardPhase phaseAfter,
        double elapsedDays,
        double scheduledDays,
        int reviewTimeMs,
        Instant reviewedAt
) {
    public static ReviewLogEntry of(UUID cardId,
                                    UUID userId,
                                    Rating rating,
                                    CardState before,
                                    CardState after,
                                    Integer reviewTimeMs) {
        return new ReviewLogEntry(
                cardId,
                userId,
                rating,
                before.phase(),
                after.phase(),
                after.elapsedDays(),
                after.scheduledDays(),
                reviewTimeMs == null ? 0 : Math.max(0, reviewTimeMs),
                after.lastReview()
        );
    }
}
