package app.sage.core.review.repository;

import app.sage.core.review.entity.StudySessionEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface StudySessionRepository extends JpaRepository<StudySessionEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from StudySessionEntity s where s.sessionId = :sessionId and s.userId = :userId")
    Optional<StudySessionEntity> findByIdForUpdate(@Param("sessionId") UUID sessionId,
                                                   @Param("userId") UUID userId);
}
