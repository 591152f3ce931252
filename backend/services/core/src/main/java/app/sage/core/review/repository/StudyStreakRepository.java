package app.sage.core.review.repository;

import app.sage.core.review.entity.StudyStreakEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StudyStreakRepository extends JpaRepository<StudyStreakEntity, UUID> {

    @Modifying
    @Query(value = """
            insert into app_core.study_streaks (user_id, current_streak, longest_streak, last_study_date, updated_at)
            values (:userId, 0, 0, null, :now)
            on conflict (user_id) do nothing
            """, nativeQuery = true)
    int ensureRow(@Param("userId") UUID userId, @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from StudyStreakEntity s where s.userId = :userId")
    Optional<StudyStreakEntity> findByIdForUpdate(@Param("userId") UUID userId);
}
