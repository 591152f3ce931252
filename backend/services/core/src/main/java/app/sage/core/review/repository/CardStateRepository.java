package app.sage.core.review.repository;

import app.sage.core.review.entity.CardStateEntity;
import app.sage.core.review.entity.CardStateId;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CardStateRepository extends JpaRepository<CardStateEntity, CardStateId> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from CardStateEntity s where s.cardId = :cardId and s.userId = :userId")
    Optional<CardStateEntity> findByIdForUpdate(@Param("cardId") UUID cardId,
                                                @Param("userId") UUID userId);

    Optional<CardStateEntity> findByCardIdAndUserId(UUID cardId, UUID userId);

    List<CardStateEntity> findByUserIdAndCardIdIn(UUID userId, Collection<UUID> cardIds);
}
