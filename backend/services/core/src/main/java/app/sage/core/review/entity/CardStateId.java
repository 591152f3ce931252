package app.sage.core.review.entity;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

public class CardStateId implements Serializable {
    private UUID cardId;
    private UUID userId;

    public CardStateId() {
    }

    public CardStateId(UUID cardId, UUID userId) {
        this.cardId = cardId;
        this.userId = userId;
    }

    public UUID getCardId() {
        return cardId;
    }

    public void setCardId(UUID cardId) {
        this.cardId = cardId;
    }

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        CardStateId that = (CardStateId) o;
        return Objects.equals(cardId, that.cardId) && Objects.equals(userId, that.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cardId, userId);
    }
}
