package app.sage.core.review.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Read model of the card catalog. Rows are owned by deck management; the review module only reads them.
 */
@Entity
@Table(name = "cards", schema = "app_core")
public class ReviewCardEntity {

    @Id
    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected ReviewCardEntity() {
    }

    public ReviewCardEntity(UUID cardId, UUID deckId, UUID userId, boolean deleted, Instant createdAt) {
        this.cardId = cardId;
        this.deckId = deckId;
        this.userId = userId;
        this.deleted = deleted;
        this.createdAt = createdAt;
    }

    public UUID getCardId() {
        return cardId;
    }

    public UUID getDeckId() {
        return deckId;
    }

    public UUID getUserId() {
        return userId;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
