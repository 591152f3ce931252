package app.sage.core.review.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StudyStreakTest {

    private static final LocalDate TODAY = LocalDate.parse("2026-03-10");

    @Test
    void firstStudyDayStartsStreak() {
        StudyStreak streak = StudyStreak.NONE.recordStudyOn(TODAY);

        assertThat(streak).isEqualTo(new StudyStreak(1, 1, TODAY));
    }

    @Test
    void studyOnNextDayExtendsStreak() {
        StudyStreak streak = new StudyStreak(4, 4, TODAY.minusDays(1)).recordStudyOn(TODAY);

        assertThat(streak.current()).isEqualTo(5);
        assertThat(streak.longest()).isEqualTo(5);
        assertThat(streak.lastStudyDate()).isEqualTo(TODAY);
    }

    @Test
    void secondSessionSameDayLeavesStreakUnchanged() {
        StudyStreak before = new StudyStreak(3, 7, TODAY);

        assertThat(before.recordStudyOn(TODAY)).isSameAs(before);
    }

    @Test
    void gapRestartsStreakButKeepsLongest() {
        StudyStreak streak = new StudyStreak(6, 9, TODAY.minusDays(2)).recordStudyOn(TODAY);

        assertThat(streak).isEqualTo(new StudyStreak(1, 9, TODAY));
    }

    @Test
    void earlierDayThanLastStudyIsIgnored() {
        StudyStreak before = new StudyStreak(2, 2, TODAY);

        assertThat(before.recordStudyOn(TODAY.minusDays(1))).isSameAs(before);
    }

    @Test
    void currentAsOf_dropsToZeroAfterMissedDay() {
        StudyStreak streak = new StudyStreak(5, 8, TODAY.minusDays(1));

        assertThat(streak.currentAsOf(TODAY)).isEqualTo(5);
        assertThat(streak.currentAsOf(TODAY.plusDays(1))).isZero();
        assertThat(StudyStreak.NONE.currentAsOf(TODAY)).isZero();
    }

    @Test
    void rejectsInconsistentCounts() {
        assertThatThrownBy(() -> new StudyStreak(3, 2, TODAY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StudyStreak(-1, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
