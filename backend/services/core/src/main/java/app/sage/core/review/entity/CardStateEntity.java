package app.sage.core.review.entity;

import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.CardState;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@IdClass(CardStateId.class)
@Table(name = "card_states", schema = "app_core")
public class CardStateEntity {

    @Id
    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Id
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "stability", nullable = false)
    private double stability;

    @Column(name = "difficulty", nullable = false)
    private double difficulty;

    @Column(name = "elapsed_days", nullable = false)
    private double elapsedDays;

    @Column(name = "scheduled_days", nullable = false)
    private double scheduledDays;

    @Column(name = "reps", nullable = false)
    private int reps;

    @Column(name = "lapses", nullable = false)
    private int lapses;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false)
    private CardPhase phase;

    @Column(name = "due", nullable = false)
    private Instant due;

    @Column(name = "last_review")
    private Instant lastReview;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "row_version", nullable = false)
    private Long rowVersion;

    protected CardStateEntity() {
    }

    public CardStateEntity(UUID cardId, UUID userId) {
        this.cardId = cardId;
        this.userId = userId;
    }

    public CardState toDomain() {
        return CardState.restore(stability, difficulty, elapsedDays, scheduledDays,
                reps, lapses, phase, due, lastReview);
    }

    public void apply(CardState state, Instant now) {
        this.stability = state.stability();
        this.difficulty = state.difficulty();
        this.elapsedDays = state.elapsedDays();
        this.scheduledDays = state.scheduledDays();
        this.reps = state.reps();
        this.lapses = state.lapses();
        this.phase = state.phase();
        this.due = state.due();
        this.lastReview = state.lastReview();
        this.updatedAt = now;
    }

    public UUID getCardId() {
        return cardId;
    }

    public UUID getUserId() {
        return userId;
    }

    public double getStability() {
        return stability;
    }

    public double getDifficulty() {
        return difficulty;
    }

    public double getElapsedDays() {
        return elapsedDays;
    }

    public double getScheduledDays() {
        return scheduledDays;
    }

    public int getReps() {
        return reps;
    }

    public int getLapses() {
        return lapses;
    }

    public CardPhase getPhase() {
        return phase;
    }

    public Instant getDue() {
        return due;
    }

    public Instant getLastReview() {
        return lastReview;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getRowVersion() {
        return rowVersion;
    }
}
