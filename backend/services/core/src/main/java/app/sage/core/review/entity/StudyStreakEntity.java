package app.sage.core.review.entity;

import app.sage.core.review.domain.StudyStreak;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "study_streaks", schema = "app_core")
public class StudyStreakEntity {

    @Id
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "current_streak", nullable = false)
    private int currentStreak;

    @Column(name = "longest_streak", nullable = false)
    private int longestStreak;

    @Column(name = "last_study_date")
    private LocalDate lastStudyDate;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected StudyStreakEntity() {
    }

    public StudyStreakEntity(UUID userId) {
        this.userId = userId;
    }

    public StudyStreak toDomain() {
        return new StudyStreak(currentStreak, longestStreak, lastStudyDate);
    }

    public void apply(StudyStreak streak, Instant now) {
        this.currentStreak = streak.current();
        this.longestStreak = streak.longest();
        this.lastStudyDate = streak.lastStudyDate();
        this.updatedAt = now;
    }

    public UUID getUserId() {
        return userId;
    }

    public int getCurrentStreak() {
        return currentStreak;
    }

    public int getLongestStreak() {
        return longestStreak;
    }

    public LocalDate getLastStudyDate() {
        return lastStudyDate;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
