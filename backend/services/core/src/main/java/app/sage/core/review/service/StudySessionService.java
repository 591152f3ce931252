package app.sage.core.review.service;

import app.sage.core.review.controller.dto.DueCardsResponse;
import app.sage.core.review.controller.dto.StudySessionEndResponse;
import app.sage.core.review.controller.dto.StudySessionStartResponse;
import app.sage.core.review.domain.StudyStreak;
import app.sage.core.review.entity.StudySessionEntity;
import app.sage.core.review.entity.StudyStreakEntity;
import app.sage.core.review.repository.ReviewCardRepository;
import app.sage.core.review.repository.StudySessionRepository;
import app.sage.core.review.repository.StudyStreakRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Service
public class StudySessionService {

    private static final Logger log = LoggerFactory.getLogger(StudySessionService.class);

    static final int SESSION_QUEUE_SIZE = 20;

    private final ReviewCardRepository cardRepo;
    private final StudySessionRepository sessionRepo;
    private final StudyStreakRepository streakRepo;
    private final ReviewService reviewService;
    private final Clock clock;

    public StudySessionService(ReviewCardRepository cardRepo,
                               StudySessionRepository sessionRepo,
                               StudyStreakRepository streakRepo,
                               ReviewService reviewService,
                               Clock clock) {
        this.cardRepo = cardRepo;
        this.sessionRepo = sessionRepo;
        this.streakRepo = streakRepo;
        this.reviewService = reviewService;
        this.clock = clock;
    }

    @Transactional
    public StudySessionStartResponse startSession(UUID userId, UUID deckId) {
        if (!cardRepo.existsByUserIdAndDeckIdAndDeletedFalse(userId, deckId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Deck not found: " + deckId);
        }
        Instant now = clock.instant();
        StudySessionEntity session = sessionRepo.save(new StudySessionEntity(UUID.randomUUID(), userId, deckId, now));

        DueCardsResponse queue = reviewService.dueCards(userId, deckId, SESSION_QUEUE_SIZE);

        log.debug("Study session started sessionId={} deckId={} due={}", session.getSessionId(), deckId, queue.count());
        return new StudySessionStartResponse(session.getSessionId(), deckId, now, queue.cards(), queue.count());
    }

    @Transactional
    public StudySessionEndResponse endSession(UUID userId,
                                              UUID sessionId,
                                              Integer cardsStudied,
                                              Integer cardsCorrect,
                                              Long timeSpentMs,
                                              String timeZone) {
        int studied = cardsStudied == null ? 0 : cardsStudied;
        int correct = cardsCorrect == null ? 0 : cardsCorrect;
        long spentMs = timeSpentMs == null ? 0L : timeSpentMs;
        if (studied < 0 || correct < 0 || spentMs < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Session totals must not be negative");
        }
        if (correct > studied) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "cardsCorrect must not exceed cardsStudied");
        }
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, StudyZones.resolve(timeZone));

        StudySessionEntity session = sessionRepo.findByIdForUpdate(sessionId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId));

        // ending twice overwrites the totals; the streak only moves once per day anyway
        session.complete(studied, correct, spentMs, now);
        sessionRepo.save(session);

        StudyStreak streak = recordStudyDay(userId, today, now);

        log.debug("Study session ended sessionId={} studied={} correct={} streak={}",
                sessionId, studied, correct, streak.current());
        return new StudySessionEndResponse(
                sessionId,
                true,
                now,
                studied,
                correct,
                spentMs,
                streak.current(),
                streak.longest()
        );
    }

    private StudyStreak recordStudyDay(UUID userId, LocalDate day, Instant now) {
        streakRepo.ensureRow(userId, now);
        StudyStreakEntity entity = streakRepo.findByIdForUpdate(userId)
                .orElseThrow(() -> new IllegalStateException("Streak row missing for user " + userId));
        StudyStreak updated = entity.toDomain().recordStudyOn(day);
        entity.apply(updated, now);
        streakRepo.save(entity);
        return updated;
    }
}
