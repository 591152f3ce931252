package app.sage.core.review.algorithm;

import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.CardState;
import app.sage.core.review.domain.Rating;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FsrsSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final FsrsScheduler scheduler = new FsrsScheduler(FsrsParameters.defaults());

    @Test
    void newCard_usesLearningStepsAndSeedsMemory() {
        SchedulingPreview preview = scheduler.schedulePreview(CardState.newCard(NOW), NOW);

        assertThat(preview.again().phase()).isEqualTo(CardPhase.LEARNING);
        assertThat(preview.again().due()).isEqualTo(NOW.plus(Duration.ofMinutes(1)));
        assertThat(preview.hard().phase()).isEqualTo(CardPhase.LEARNING);
        assertThat(preview.hard().due()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
        assertThat(preview.good().phase()).isEqualTo(CardPhase.LEARNING);
        assertThat(preview.good().due()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
        assertThat(preview.easy().phase()).isEqualTo(CardPhase.REVIEW);

        assertThat(preview.again().stability()).isCloseTo(0.4, within(1e-9));
        assertThat(preview.good().stability()).isCloseTo(2.4, within(1e-9));
        assertThat(preview.easy().stability()).isCloseTo(5.8, within(1e-9));
        assertThat(preview.easy().scheduledDays()).isCloseTo(5.8, within(1e-6));

        assertThat(preview.again().difficulty()).isCloseTo(6.81, within(1e-9));
        assertThat(preview.good().difficulty()).isCloseTo(4.93, within(1e-9));
        assertThat(preview.easy().difficulty()).isCloseTo(3.99, within(1e-9));

        for (CardState next : preview.asMap().values()) {
            assertThat(next.reps()).isEqualTo(1);
            assertThat(next.lapses()).isZero();
            assertThat(next.lastReview()).isEqualTo(NOW);
        }
    }

    @Test
    void reviewCard_intervalsAreOrdered() {
        CardState state = review(10.0, 5.0, 10);

        SchedulingPreview preview = scheduler.schedulePreview(state, NOW);

        assertThat(preview.hard().scheduledDays()).isLessThan(preview.good().scheduledDays());
        assertThat(preview.good().scheduledDays()).isLessThan(preview.easy().scheduledDays());
        assertThat(preview.hard().due()).isBefore(preview.good().due());
        assertThat(preview.good().due()).isBefore(preview.easy().due());
        assertThat(preview.hard().phase()).isEqualTo(CardPhase.REVIEW);
        assertThat(preview.easy().phase()).isEqualTo(CardPhase.REVIEW);
    }

    @Test
    void reviewCard_successGrowsStabilityAndFailureDoesNot() {
        CardState state = review(10.0, 5.0, 10);

        SchedulingPreview preview = scheduler.schedulePreview(state, NOW);

        assertThat(preview.good().stability()).isGreaterThan(10.0);
        assertThat(preview.easy().stability()).isGreaterThan(preview.good().stability());
        assertThat(preview.again().stability()).isLessThanOrEqualTo(10.0);
    }

    @Test
    void newCard_easyIsScheduledLatest() {
        SchedulingPreview preview = scheduler.schedulePreview(CardState.newCard(NOW), NOW);

        assertThat(preview.easy().due())
                .isAfter(preview.good().due())
                .isAfter(preview.hard().due())
                .isAfter(preview.again().due());
    }

    @Test
    void reviewCard_recallRightAfterLastReviewStillGrowsInOrder() {
        CardState state = new CardState(10.0, 5.0, 0.0, 10.0, 5, 0, CardPhase.REVIEW,
                NOW.plus(Duration.ofDays(10)), NOW);

        SchedulingPreview preview = scheduler.schedulePreview(state, NOW);

        assertThat(preview.hard().stability()).isGreaterThan(10.0);
        assertThat(preview.good().stability()).isGreaterThan(preview.hard().stability());
        assertThat(preview.easy().stability()).isGreaterThan(preview.good().stability());
        assertThat(preview.hard().scheduledDays()).isLessThan(preview.good().scheduledDays());
        assertThat(preview.good().scheduledDays()).isLessThan(preview.easy().scheduledDays());
    }

    @Test
    void reviewCard_againAtDueTimeShrinksStability() {
        Instant last = NOW.minus(Duration.ofDays(30));
        CardState state = new CardState(30.0, 5.0, 0.0, 30.0, 4, 0, CardPhase.REVIEW, NOW, last);

        CardState again = scheduler.schedulePreview(state, NOW).again();

        assertThat(again.phase()).isEqualTo(CardPhase.RELEARNING);
        assertThat(again.stability()).isLessThan(30.0);
        assertThat(again.lapses()).isEqualTo(1);
    }

    @Test
    void reviewCard_againLapsesIntoRelearning() {
        CardState state = review(10.0, 5.0, 10);

        CardState again = scheduler.schedulePreview(state, NOW).again();

        assertThat(again.phase()).isEqualTo(CardPhase.RELEARNING);
        assertThat(again.lapses()).isEqualTo(state.lapses() + 1);
        assertThat(again.reps()).isEqualTo(state.reps() + 1);
        assertThat(again.due()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
    }

    @Test
    void reviewCard_difficultyMovesWithRating() {
        CardState state = review(10.0, 5.0, 10);

        SchedulingPreview preview = scheduler.schedulePreview(state, NOW);

        assertThat(preview.again().difficulty()).isGreaterThan(5.0);
        assertThat(preview.easy().difficulty()).isLessThan(5.0);
        assertThat(preview.again().difficulty()).isGreaterThan(preview.hard().difficulty());
        assertThat(preview.hard().difficulty()).isGreaterThan(preview.good().difficulty());
    }

    @Test
    void learningCard_againAndHardStayInPhase() {
        CardState state = learning(CardPhase.LEARNING);

        SchedulingPreview preview = scheduler.schedulePreview(state, NOW);

        assertThat(preview.again().phase()).isEqualTo(CardPhase.LEARNING);
        assertThat(preview.again().due()).isEqualTo(NOW.plus(Duration.ofMinutes(1)));
        assertThat(preview.hard().phase()).isEqualTo(CardPhase.LEARNING);
        assertThat(preview.hard().due()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
        assertThat(preview.good().phase()).isEqualTo(CardPhase.REVIEW);
        assertThat(preview.good().scheduledDays()).isGreaterThanOrEqualTo(1.0);
        assertThat(preview.easy().scheduledDays()).isGreaterThanOrEqualTo(preview.good().scheduledDays() + 1.0);
        assertThat(preview.again().lapses()).isZero();
    }

    @Test
    void relearningCard_graduatesBackToReview() {
        CardState state = learning(CardPhase.RELEARNING);

        SchedulingPreview preview = scheduler.schedulePreview(state, NOW);

        assertThat(preview.again().phase()).isEqualTo(CardPhase.RELEARNING);
        assertThat(preview.good().phase()).isEqualTo(CardPhase.REVIEW);
        assertThat(preview.easy().phase()).isEqualTo(CardPhase.REVIEW);
    }

    @Test
    void intervalsNeverExceedMaximum() {
        FsrsParameters capped = new FsrsParameters(0.9, 30, FsrsParameters.DEFAULT_WEIGHTS, 1, 5, 10, 10, 1.3);
        FsrsScheduler cappedScheduler = new FsrsScheduler(capped);

        SchedulingPreview preview = cappedScheduler.schedulePreview(review(500.0, 3.0, 400), NOW);

        for (CardState next : preview.asMap().values()) {
            assertThat(next.scheduledDays()).isLessThanOrEqualTo(30.0);
        }
    }

    @Test
    void intervalsStayStrictlyOrderedAtTheCap() {
        FsrsParameters capped = new FsrsParameters(0.9, 30, FsrsParameters.DEFAULT_WEIGHTS, 1, 5, 10, 10, 1.3);
        FsrsScheduler cappedScheduler = new FsrsScheduler(capped);

        SchedulingPreview preview = cappedScheduler.schedulePreview(review(500.0, 3.0, 400), NOW);

        assertThat(preview.easy().scheduledDays()).isEqualTo(30.0);
        assertThat(preview.good().scheduledDays()).isEqualTo(29.0);
        assertThat(preview.hard().scheduledDays()).isEqualTo(28.0);
        assertThat(preview.hard().due()).isBefore(preview.good().due());
        assertThat(preview.good().due()).isBefore(preview.easy().due());
    }

    @Test
    void schedulePreview_isDeterministicAndLeavesInputUntouched() {
        CardState state = review(7.5, 6.2, 9);
        CardState copy = new CardState(state.stability(), state.difficulty(), state.elapsedDays(),
                state.scheduledDays(), state.reps(), state.lapses(), state.phase(), state.due(), state.lastReview());

        SchedulingPreview first = scheduler.schedulePreview(state, NOW);
        SchedulingPreview second = scheduler.schedulePreview(state, NOW);

        assertThat(first).isEqualTo(second);
        assertThat(state).isEqualTo(copy);
    }

    @Test
    void corruptStateIsSanitizedBeforeScheduling() {
        CardState corrupt = new CardState(Double.NaN, 99.0, -3.0, -1.0, 4, 1,
                CardPhase.REVIEW, NOW.minus(Duration.ofDays(1)), NOW.minus(Duration.ofDays(3)));

        SchedulingPreview preview = scheduler.schedulePreview(corrupt, NOW);

        for (CardState next : preview.asMap().values()) {
            assertThat(next.stability()).isBetween(CardState.MIN_STABILITY, CardState.MAX_STABILITY);
            assertThat(next.difficulty()).isBetween(CardState.MIN_DIFFICULTY, CardState.MAX_DIFFICULTY);
            assertThat(next.due()).isAfterOrEqualTo(NOW);
        }
    }

    @Test
    void forRating_matchesRecordComponents() {
        SchedulingPreview preview = scheduler.schedulePreview(CardState.newCard(NOW), NOW);

        assertThat(preview.forRating(Rating.AGAIN)).isSameAs(preview.again());
        assertThat(preview.asMap()).containsOnlyKeys(Rating.values());
    }

    private static CardState review(double stability, double difficulty, int daysSinceReview) {
        Instant last = NOW.minus(Duration.ofDays(daysSinceReview));
        return new CardState(stability, difficulty, 0.0, stability, 5, 1,
                CardPhase.REVIEW, last.plus(Duration.ofDays((long) stability)), last);
    }

    private static CardState learning(CardPhase phase) {
        Instant last = NOW.minus(Duration.ofMinutes(10));
        return new CardState(2.4, 4.93, 0.0, 10 / 1440.0, 1, 0, phase, NOW, last);
    }
}
