package app.sage.core.review.repository;

import app.sage.core.review.entity.ReviewLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReviewLogRepository extends JpaRepository<ReviewLogEntity, Long> {

    List<ReviewLogEntity> findByCardIdAndUserIdOrderByReviewedAtAsc(UUID cardId, UUID userId);
}
