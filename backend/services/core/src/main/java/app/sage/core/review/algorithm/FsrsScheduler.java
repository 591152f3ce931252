package app.sage.core.review.algorithm;

import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.CardState;
import app.sage.core.review.domain.ForgettingCurve;
import app.sage.core.review.domain.Rating;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;

/**
 * FSRS v4 style scheduler. Computes the four candidate next states of a card without
 * touching anything, so the same call backs both the interval preview and the committed review.
 */
@Component
public class FsrsScheduler {

    private static final double MINUTES_PER_DAY = 1440.0;
    private static final double MILLIS_PER_DAY = 86_400_000.0;
    static final double MIN_RECALL_GAIN = 0.01;

    private final FsrsParameters params;

    public FsrsScheduler(FsrsParameters params) {
        this.params = Objects.requireNonNull(params, "params");
    }

    public FsrsParameters parameters() {
        return params;
    }

    public SchedulingPreview schedulePreview(CardState state, Instant now) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(now, "now");

        CardState current = state.sanitized();
        return switch (current.phase()) {
            case NEW -> scheduleNew(now);
            case LEARNING, RELEARNING -> scheduleLearning(current, now);
            case REVIEW -> scheduleReview(current, now);
        };
    }

    private SchedulingPreview scheduleNew(Instant now) {
        double goodStep = minutes(params.goodStepMinutes());
        double easyDays = Math.max(reviewInterval(initialStability(Rating.EASY)), goodStep);

        return new SchedulingPreview(
                seeded(Rating.AGAIN, CardPhase.LEARNING, minutes(params.againStepMinutes()), now),
                seeded(Rating.HARD, CardPhase.LEARNING, minutes(params.hardStepMinutes()), now),
                seeded(Rating.GOOD, CardPhase.LEARNING, goodStep, now),
                seeded(Rating.EASY, CardPhase.REVIEW, easyDays, now)
        );
    }

    private SchedulingPreview scheduleLearning(CardState st, Instant now) {
        double elapsed = st.elapsedDaysAt(now);
        double s = st.stability();
        double d = st.difficulty();
        double r = ForgettingCurve.retrievability(elapsed, s);
        CardPhase phase = st.phase();

        CardState again = next(st, phase, s, nextDifficulty(d, Rating.AGAIN),
                elapsed, minutes(params.againStepMinutes()), 0, now);
        CardState hard = next(st, phase, s, nextDifficulty(d, Rating.HARD),
                elapsed, minutes(params.hardStepMinutes()), 0, now);

        double goodD = nextDifficulty(d, Rating.GOOD);
        double goodS = stabilityAfterRecall(goodD, s, r, Rating.GOOD);
        double easyD = nextDifficulty(d, Rating.EASY);
        double easyS = CardState.clampStability(
                stabilityAfterRecall(easyD, s, r, Rating.EASY) * params.easyBonus());

        double easyDays = Math.max(reviewInterval(easyS), reviewInterval(goodS) + 1.0);
        easyDays = Math.min(easyDays, params.maximumIntervalDays());
        double goodDays = belowCap(reviewInterval(goodS), easyDays);

        return new SchedulingPreview(
                again,
                hard,
                next(st, CardPhase.REVIEW, goodS, goodD, elapsed, goodDays, 0, now),
                next(st, CardPhase.REVIEW, easyS, easyD, elapsed, easyDays, 0, now)
        );
    }

    private SchedulingPreview scheduleReview(CardState st, Instant now) {
        double elapsed = st.elapsedDaysAt(now);
        double s = st.stability();
        double d = st.difficulty();
        double r = ForgettingCurve.retrievability(elapsed, s);

        double againD = nextDifficulty(d, Rating.AGAIN);
        double againS = Math.min(s, stabilityAfterForgetting(againD, s, r));
        CardState again = next(st, CardPhase.RELEARNING, againS, againD,
                elapsed, minutes(params.relearningStepMinutes()), 1, now);

        double hardD = nextDifficulty(d, Rating.HARD);
        double goodD = nextDifficulty(d, Rating.GOOD);
        double easyD = nextDifficulty(d, Rating.EASY);
        double hardS = stabilityAfterRecall(hardD, s, r, Rating.HARD);
        double goodS = stabilityAfterRecall(goodD, s, r, Rating.GOOD);
        double easyS = stabilityAfterRecall(easyD, s, r, Rating.EASY);

        // hard < good < easy; the cap is handed out top-down so the order survives it
        double hardDays = reviewInterval(hardS);
        double goodDays = Math.max(reviewInterval(goodS), hardDays + 1.0);
        double easyDays = Math.min(Math.max(reviewInterval(easyS), goodDays + 1.0), params.maximumIntervalDays());
        goodDays = belowCap(goodDays, easyDays);
        hardDays = belowCap(hardDays, goodDays);

        return new SchedulingPreview(
                again,
                next(st, CardPhase.REVIEW, hardS, hardD, elapsed, hardDays, 0, now),
                next(st, CardPhase.REVIEW, goodS, goodD, elapsed, goodDays, 0, now),
                next(st, CardPhase.REVIEW, easyS, easyD, elapsed, easyDays, 0, now)
        );
    }

    private CardState seeded(Rating rating, CardPhase phase, double scheduledDays, Instant now) {
        return new CardState(
                initialStability(rating),
                initialDifficulty(rating),
                0.0,
                scheduledDays,
                1,
                0,
                phase,
                dueAt(now, scheduledDays),
                now
        );
    }

    private static CardState next(CardState from,
                                  CardPhase phase,
                                  double stability,
                                  double difficulty,
                                  double elapsedDays,
                                  double scheduledDays,
                                  int lapseDelta,
                                  Instant now) {
        return new CardState(
                stability,
                difficulty,
                elapsedDays,
                scheduledDays,
                from.reps() + 1,
                from.lapses() + lapseDelta,
                phase,
                dueAt(now, scheduledDays),
                now
        );
    }

    private double reviewInterval(double stability) {
        double days = ForgettingCurve.intervalDays(stability, params.requestRetention());
        return clamp(days, 1.0, params.maximumIntervalDays());
    }

    /**
     * Keeps {@code days} at least one day under {@code longer}. Only a maximum interval
     * below three days can force a tie, since no review interval goes under one day.
     */
    private static double belowCap(double days, double longer) {
        return Math.max(1.0, Math.min(days, longer - 1.0));
    }

    private double initialStability(Rating rating) {
        return CardState.clampStability(params.w(rating.code() - 1));
    }

    private double initialDifficulty(Rating rating) {
        return CardState.clampDifficulty(params.w(4) - (rating.code() - 3.0) * params.w(5));
    }

    private double nextDifficulty(double d, Rating rating) {
        double shifted = d - params.w(6) * (rating.code() - 3.0);
        double reverted = params.w(7) * initialDifficulty(Rating.GOOD) + (1.0 - params.w(7)) * shifted;
        return CardState.clampDifficulty(reverted);
    }

    private double stabilityAfterRecall(double d, double s, double r, Rating rating) {
        double hardPenalty = (rating == Rating.HARD) ? params.w(15) : 1.0;
        double easyBonus = (rating == Rating.EASY) ? params.w(16) : 1.0;

        // a recall right after the last review still counts for something
        double recallGain = Math.max(Math.exp((1.0 - r) * params.w(10)) - 1.0, MIN_RECALL_GAIN);
        double growth = Math.exp(params.w(8))
                * (11.0 - d)
                * Math.pow(s, -params.w(9))
                * recallGain
                * hardPenalty
                * easyBonus;

        return CardState.clampStability(s * (1.0 + growth));
    }

    private double stabilityAfterForgetting(double d, double s, double r) {
        double out = params.w(11)
                * Math.pow(d, -params.w(12))
                * (Math.pow(s + 1.0, params.w(13)) - 1.0)
                * Math.exp((1.0 - r) * params.w(14));
        return CardState.clampStability(out);
    }

    private static double minutes(int minutes) {
        return minutes / MINUTES_PER_DAY;
    }

    private static Instant dueAt(Instant now, double scheduledDays) {
        return now.plusMillis(Math.round(scheduledDays * MILLIS_PER_DAY));
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
