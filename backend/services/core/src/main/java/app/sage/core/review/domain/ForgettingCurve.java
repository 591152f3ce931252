package app.sage.core.review.domain;

/**
 * Power forgetting curve shared by the card model and the scheduler.
 * With a requested retention of 0.9 the optimal interval equals the stability.
 */
public final class ForgettingCurve {

    private static final double DECAY_SCALE = 9.0;

    private ForgettingCurve() {
    }

    public static double retrievability(double elapsedDays, double stability) {
        if (!(stability > 0.0)) return 0.0;
        double t = (elapsedDays > 0.0) ? elapsedDays : 0.0;
        return 1.0 / (1.0 + t / (DECAY_SCALE * stability));
    }

    public static double intervalDays(double stability, double requestRetention) {
        return DECAY_SCALE * stability * (1.0 / requestRetention - 1.0);
    }
}
