package app.sage.core.review.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Scheduling state of one card for one learner.
 * <p>
 * Values are immutable; every review produces a new instance. {@link #restore} is the entry
 * point for rows coming back from storage and clamps anything out of range instead of failing.
 */
public record CardState(
        double stability,
        double difficulty,
        double elapsedDays,
        double scheduledDays,
        int reps,
        int lapses,
        CardPhase phase,
        Instant due,
        Instant lastReview
) {
    public static final double MIN_STABILITY = 0.1;
    public static final double MAX_STABILITY = 36500.0;
    public static final double MIN_DIFFICULTY = 1.0;
    public static final double MAX_DIFFICULTY = 10.0;

    private static final double DEFAULT_DIFFICULTY = 5.0;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    public CardState {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(due, "due");
    }

    public static CardState newCard(Instant createdAt) {
        return new CardState(0.0, 0.0, 0.0, 0.0, 0, 0, CardPhase.NEW, createdAt, null);
    }

    public static CardState orNew(Optional<CardState> stored, Instant createdAt) {
        return stored.orElseGet(() -> newCard(createdAt));
    }

    public static CardState restore(double stability,
                                    double difficulty,
                                    double elapsedDays,
                                    double scheduledDays,
                                    int reps,
                                    int lapses,
                                    CardPhase phase,
                                    Instant due,
                                    Instant lastReview) {
        if (phase == null || phase == CardPhase.NEW) {
            return newCard(due == null ? Instant.EPOCH : due);
        }

        Instant safeDue = due;
        if (safeDue == null) {
            safeDue = (lastReview == null) ? Instant.EPOCH : lastReview;
        }

        return new CardState(
                clampStability(stability),
                clampDifficulty(difficulty),
                clampDays(elapsedDays),
                clampDays(scheduledDays),
                Math.max(0, reps),
                Math.max(0, lapses),
                phase,
                safeDue,
                lastReview
        );
    }

    public CardState sanitized() {
        return restore(stability, difficulty, elapsedDays, scheduledDays, reps, lapses, phase, due, lastReview);
    }

    public boolean isDue(Instant now) {
        return phase == CardPhase.NEW || !due.isAfter(now);
    }

    public double elapsedDaysAt(Instant now) {
        if (lastReview == null) return 0.0;
        double days = Duration.between(lastReview, now).toMillis() / MILLIS_PER_DAY;
        return clampDays(days);
    }

    public double retrievability(Instant now) {
        if (phase == CardPhase.NEW) return 0.0;
        return ForgettingCurve.retrievability(elapsedDaysAt(now), stability);
    }

    public static double clampDifficulty(double d) {
        if (Double.isNaN(d)) return DEFAULT_DIFFICULTY;
        return Math.max(MIN_DIFFICULTY, Math.min(MAX_DIFFICULTY, d));
    }

    public static double clampStability(double s) {
        if (Double.isNaN(s) || s < MIN_STABILITY) return MIN_STABILITY;
        return Math.min(MAX_STABILITY, s);
    }

    private static double clampDays(double days) {
        if (Double.isNaN(days) || days < 0.0) return 0.0;
        return Math.min(MAX_STABILITY, days);
    }
}
