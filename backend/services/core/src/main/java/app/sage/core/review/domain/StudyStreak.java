package app.sage.core.review.domain;

import java.time.LocalDate;

/**
 * Consecutive local days with at least one finished study session.
 */
public record StudyStreak(int current, int longest, LocalDate lastStudyDate) {

    public static final StudyStreak NONE = new StudyStreak(0, 0, null);

    public StudyStreak {
        if (current < 0 || longest < current) {
            throw new IllegalArgumentException("Invalid streak: current=" + current + ", longest=" + longest);
        }
    }

    /**
     * Counts {@code day} into the streak. A day right after the last one (or the very first day) extends it,
     * the same day leaves it as is, and any gap restarts it at one.
     */
    public StudyStreak recordStudyOn(LocalDate day) {
        int next;
        if (lastStudyDate == null || lastStudyDate.plusDays(1).equals(day)) {
            next = current + 1;
        } else if (!lastStudyDate.isBefore(day)) {
            // same day, or a clock that went backwards
            return this;
        } else {
            next = 1;
        }
        return new StudyStreak(next, Math.max(longest, next), day);
    }

    /**
     * Current streak as seen on {@code today}: zero once a whole day has passed without study.
     */
    public int currentAsOf(LocalDate today) {
        if (lastStudyDate == null || lastStudyDate.isBefore(today.minusDays(1))) {
            return 0;
        }
        return current;
    }
}
