package app.sage.core.review.controller.dto;

import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.CardState;

import java.time.Instant;

public record CardStateDto(
        CardPhase phase,
        double stability,
        double difficulty,
        double elapsedDays,
        double scheduledDays,
        int reps,
        int lapses,
        Instant due,
        Instant lastReview,
        double retrievability
) {
    public static CardStateDto of(CardState state, Instant now) {
        return new CardStateDto(
                state.phase(),
                state.stability(),
                state.difficulty(),
                state.elapsedDays(),
                state.scheduledDays(),
                state.reps(),
                state.lapses(),
                state.due(),
                state.lastReview(),
                state.retrievability(now)
        );
    }
}
