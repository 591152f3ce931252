package app.sage.core.review.algorithm;

import java.util.List;

/**
 * Tunable constants of the scheduler. Only the ordering guarantees of the algorithm are
 * load-bearing; the concrete numbers can be replaced through configuration.
 *
 * @param requestRetention      retrievability at which a review becomes due, in (0, 1)
 * @param maximumIntervalDays   upper bound for any review interval
 * @param weights               17 FSRS v4 weights: initial stabilities (0-3), difficulty (4-7),
 *                              recall (8-10), forgetting (11-14), hard penalty (15), easy bonus (16)
 * @param againStepMinutes      re-queue delay after Again in a learning phase
 * @param hardStepMinutes       re-queue delay after Hard in a learning phase
 * @param goodStepMinutes       re-queue delay after Good on a new card
 * @param relearningStepMinutes delay after a lapse
 * @param easyBonus             stability multiplier when graduating with Easy
 */
public record FsrsParameters(
        double requestRetention,
        double maximumIntervalDays,
        List<Double> weights,
        int againStepMinutes,
        int hardStepMinutes,
        int goodStepMinutes,
        int relearningStepMinutes,
        double easyBonus
) {
    public static final int WEIGHT_COUNT = 17;

    public static final List<Double> DEFAULT_WEIGHTS = List.of(
            0.4, 0.6, 2.4, 5.8,
            4.93, 0.94, 0.86, 0.01,
            1.49, 0.14, 0.94,
            2.18, 0.05, 0.34, 1.26,
            0.29, 2.61
    );

    public FsrsParameters {
        if (!(requestRetention > 0.0 && requestRetention < 1.0)) {
            throw new IllegalArgumentException("requestRetention must be in (0, 1): " + requestRetention);
        }
        if (!(maximumIntervalDays >= 1.0)) {
            throw new IllegalArgumentException("maximumIntervalDays must be >= 1: " + maximumIntervalDays);
        }
        if (weights == null || weights.size() != WEIGHT_COUNT) {
            throw new IllegalArgumentException("Expected " + WEIGHT_COUNT + " weights, got "
                    + (weights == null ? 0 : weights.size()));
        }
        if (againStepMinutes < 1 || hardStepMinutes < 1 || goodStepMinutes < 1 || relearningStepMinutes < 1) {
            throw new IllegalArgumentException("Learning steps must be at least one minute");
        }
        if (!(easyBonus >= 1.0)) {
            throw new IllegalArgumentException("easyBonus must be >= 1: " + easyBonus);
        }
        weights = List.copyOf(weights);
    }

    public static FsrsParameters defaults() {
        return new FsrsParameters(0.9, 36500, DEFAULT_WEIGHTS, 1, 5, 10, 10, 1.3);
    }

    public double w(int index) {
        return weights.get(index);
    }
}
