package app.sage.core.review.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "study_sessions", schema = "app_core")
public class StudySessionEntity {

    @Id
    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cards_studied", nullable = false)
    private int cardsStudied;

    @Column(name = "cards_correct", nullable = false)
    private int cardsCorrect;

    @Column(name = "time_spent_ms", nullable = false)
    private long timeSpentMs;

    protected StudySessionEntity() {
    }

    public StudySessionEntity(UUID sessionId, UUID userId, UUID deckId, Instant startedAt) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.deckId = deckId;
        this.startedAt = startedAt;
    }

    public void complete(int cardsStudied, int cardsCorrect, long timeSpentMs, Instant completedAt) {
        this.cardsStudied = cardsStudied;
        this.cardsCorrect = cardsCorrect;
        this.timeSpentMs = timeSpentMs;
        this.completedAt = completedAt;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getDeckId() {
        return deckId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public int getCardsStudied() {
        return cardsStudied;
    }

    public int getCardsCorrect() {
        return cardsCorrect;
    }

    public long getTimeSpentMs() {
        return timeSpentMs;
    }
}
