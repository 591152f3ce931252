package app.sage.core.review.repository;

import app.sage.core.review.entity.ReviewCardEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReviewCardRepository extends JpaRepository<ReviewCardEntity, UUID> {

    Optional<ReviewCardEntity> findByCardIdAndUserIdAndDeletedFalse(UUID cardId, UUID userId);

    List<ReviewCardEntity> findByUserIdAndDeletedFalseOrderByCreatedAtAscCardIdAsc(UUID userId);

    List<ReviewCardEntity> findByUserIdAndDeckIdAndDeletedFalseOrderByCreatedAtAscCardIdAsc(UUID userId, UUID deckId);

    boolean existsByUserIdAndDeckIdAndDeletedFalse(UUID userId, UUID deckId);
}
