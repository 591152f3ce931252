package app.sage.core.review.algorithm;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Display projection of an interval. Rounds for humans only; stored intervals stay exact.
 */
public final class IntervalFormatter {

    private IntervalFormatter() {
    }

    public static String format(double days) {
        if (!(days > 0.0)) return "< 1 min";
        if (days < 1.0) {
            long hours = Math.round(days * 24.0);
            if (hours < 1) return Math.max(1, Math.round(days * 1440.0)) + " min";
            return hours + " hr";
        }
        long wholeDays = Math.round(days);
        if (wholeDays == 1) return "1 day";
        if (days < 30.0) return wholeDays + " days";
        if (days < 365.0) return Math.round(days / 30.0) + " mo";
        return String.format(Locale.ROOT, "%.1f yr", days / 365.0);
    }

    public static String format(Instant from, Instant to) {
        long millis = Math.max(0, Duration.between(from, to).toMillis());
        return format(millis / 86_400_000.0);
    }
}
