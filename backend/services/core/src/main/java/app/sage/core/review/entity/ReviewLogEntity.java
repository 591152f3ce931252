package app.sage.core.review.entity;

import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.ReviewLogEntry;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "review_logs", schema = "app_core")
public class ReviewLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "rating", nullable = false)
    private Short rating;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase_before", nullable = false)
    private CardPhase phaseBefore;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase_after", nullable = false)
    private CardPhase phaseAfter;

    @Column(name = "elapsed_days", nullable = false)
    private double elapsedDays;

    @Column(name = "scheduled_days", nullable = false)
    private double scheduledDays;

    @Column(name = "review_time_ms", nullable = false)
    private int reviewTimeMs;

    @Column(name = "reviewed_at", nullable = false)
    private Instant reviewedAt;

    protected ReviewLogEntity() {
    }

    public static ReviewLogEntity from(ReviewLogEntry entry) {
        ReviewLogEntity e = new ReviewLogEntity();
        e.cardId = entry.cardId();
        e.userId = entry.userId();
        e.rating = (short) entry.rating().code();
        e.phaseBefore = entry.phaseBefore();
        e.phaseAfter = entry.phaseAfter();
        e.elapsedDays = entry.elapsedDays();
        e.scheduledDays = entry.scheduledDays();
        e.reviewTimeMs = entry.reviewTimeMs();
        e.reviewedAt = entry.reviewedAt();
        return e;
    }

    public Long getId() {
        return id;
    }

    public UUID getCardId() {
        return cardId;
    }

    public UUID getUserId() {
        return userId;
    }

    public Short getRating() {
        return rating;
    }

    public CardPhase getPhaseBefore() {
        return phaseBefore;
    }

    public CardPhase getPhaseAfter() {
        return phaseAfter;
    }

    public double getElapsedDays() {
        return elapsedDays;
    }

    public double getScheduledDays() {
        return scheduledDays;
    }

    public int getReviewTimeMs() {
        return reviewTimeMs;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }
}
