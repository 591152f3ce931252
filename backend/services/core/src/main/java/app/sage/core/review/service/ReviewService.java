package app.sage.core.review.service;

import app.sage.core.review.algorithm.DueQueueSelector;
import app.sage.core.review.algorithm.FsrsScheduler;
import app.sage.core.review.algorithm.IntervalFormatter;
import app.sage.core.review.algorithm.Reviewer;
import app.sage.core.review.algorithm.SchedulingPreview;
import app.sage.core.review.controller.dto.CardStateDto;
import app.sage.core.review.controller.dto.DueCardResponse;
import app.sage.core.review.controller.dto.DueCardsResponse;
import app.sage.core.review.controller.dto.IntervalPreview;
import app.sage.core.review.controller.dto.ReviewAnswerResponse;
import app.sage.core.review.controller.dto.ReviewHistoryItem;
import app.sage.core.review.domain.CardState;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.ReviewLogEntry;
import app.sage.core.review.entity.CardStateEntity;
import app.sage.core.review.entity.ReviewCardEntity;
import app.sage.core.review.entity.ReviewLogEntity;
import app.sage.core.review.repository.CardStateRepository;
import app.sage.core.review.repository.ReviewCardRepository;
import app.sage.core.review.repository.ReviewLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private static final int MAX_LIMIT = 200;

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String FOREIGN_KEY_VIOLATION = "23503";

    private final ReviewCardRepository cardRepo;
    private final CardStateRepository stateRepo;
    private final ReviewLogRepository logRepo;
    private final FsrsScheduler scheduler;
    private final Reviewer reviewer;
    private final DueQueueSelector selector;
    private final Clock clock;

    public ReviewService(ReviewCardRepository cardRepo,
                         CardStateRepository stateRepo,
                         ReviewLogRepository logRepo,
                         FsrsScheduler scheduler,
                         Reviewer reviewer,
                         DueQueueSelector selector,
                         Clock clock) {
        this.cardRepo = cardRepo;
        this.stateRepo = stateRepo;
        this.logRepo = logRepo;
        this.scheduler = scheduler;
        this.reviewer = reviewer;
        this.selector = selector;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public DueCardsResponse dueCards(UUID userId, UUID deckId, Integer limit) {
        Instant now = clock.instant();
        int boundedLimit = normalizeLimit(limit);

        List<ReviewCardEntity> cards = (deckId == null)
                ? cardRepo.findByUserIdAndDeletedFalseOrderByCreatedAtAscCardIdAsc(userId)
                : cardRepo.findByUserIdAndDeckIdAndDeletedFalseOrderByCreatedAtAscCardIdAsc(userId, deckId);
        if (cards.isEmpty()) {
            return new DueCardsResponse(List.of(), 0);
        }

        Map<UUID, CardState> states = loadStates(userId, cards);
        List<StudyCandidate> candidates = new ArrayList<>(cards.size());
        for (ReviewCardEntity card : cards) {
            CardState state = states.get(card.getCardId());
            candidates.add(new StudyCandidate(card, state == null ? CardState.newCard(card.getCreatedAt()) : state));
        }

        List<DueCardResponse> out = selector.selectDue(candidates, StudyCandidate::state, now, boundedLimit)
                .stream()
                .map(c -> toDueCard(c, now))
                .toList();
        return new DueCardsResponse(out, out.size());
    }

    @Transactional(readOnly = true)
    public DueCardResponse preview(UUID userId, UUID cardId) {
        Instant now = clock.instant();
        ReviewCardEntity card = requireCard(userId, cardId);
        CardState state = CardState.orNew(
                stateRepo.findByCardIdAndUserId(cardId, userId).map(this::restore),
                card.getCreatedAt()
        );
        return toDueCard(new StudyCandidate(card, state), now);
    }

    @Transactional
    public ReviewAnswerResponse answer(UUID userId, UUID cardId, Rating rating, Integer reviewTimeMs) {
        Instant now = clock.instant();
        ReviewCardEntity card = requireCard(userId, cardId);

        Optional<CardStateEntity> current = stateRepo.findByIdForUpdate(cardId, userId);
        CardState before = CardState.orNew(current.map(this::restore), card.getCreatedAt());
        CardState after = reviewer.applyReview(before, rating, now);

        CardStateEntity entity = current.orElseGet(() -> new CardStateEntity(cardId, userId));
        entity.apply(after, now);
        try {
            stateRepo.saveAndFlush(entity);
        } catch (DataIntegrityViolationException ex) {
            String sqlState = sqlStateOf(ex);
            if (UNIQUE_VIOLATION.equals(sqlState)) {
                // another transaction inserted the first state for this key
                throw new ResponseStatusException(HttpStatus.CONFLICT,
                        "Card " + cardId + " was reviewed concurrently", ex);
            }
            if (FOREIGN_KEY_VIOLATION.equals(sqlState)) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Card not found: " + cardId, ex);
            }
            throw ex;
        }

        logRepo.save(ReviewLogEntity.from(ReviewLogEntry.of(cardId, userId, rating, before, after, reviewTimeMs)));

        log.debug("Review applied cardId={} rating={} phase={}->{} scheduledDays={}",
                cardId, rating, before.phase(), after.phase(), after.scheduledDays());

        return new ReviewAnswerResponse(
                cardId,
                rating,
                CardStateDto.of(after, now),
                after.due(),
                IntervalFormatter.format(after.scheduledDays())
        );
    }

    @Transactional(readOnly = true)
    public List<ReviewHistoryItem> history(UUID userId, UUID cardId) {
        requireCard(userId, cardId);
        return logRepo.findByCardIdAndUserIdOrderByReviewedAtAsc(cardId, userId)
                .stream()
                .map(l -> new ReviewHistoryItem(
                        Rating.fromCode(l.getRating()),
                        l.getPhaseBefore(),
                        l.getPhaseAfter(),
                        l.getElapsedDays(),
                        l.getScheduledDays(),
                        l.getReviewTimeMs(),
                        l.getReviewedAt()
                ))
                .toList();
    }

    private ReviewCardEntity requireCard(UUID userId, UUID cardId) {
        return cardRepo.findByCardIdAndUserIdAndDeletedFalse(cardId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Card not found: " + cardId));
    }

    private Map<UUID, CardState> loadStates(UUID userId, List<ReviewCardEntity> cards) {
        List<UUID> ids = cards.stream().map(ReviewCardEntity::getCardId).toList();
        Map<UUID, CardState> out = new HashMap<>();
        for (CardStateEntity e : stateRepo.findByUserIdAndCardIdIn(userId, ids)) {
            out.put(e.getCardId(), restore(e));
        }
        return out;
    }

    private CardState restore(CardStateEntity e) {
        CardState state = e.toDomain();
        if (!matchesStored(e, state)) {
            log.warn("Clamped out-of-range card state cardId={} userId={} stability={} difficulty={}",
                    e.getCardId(), e.getUserId(), e.getStability(), e.getDifficulty());
        }
        return state;
    }

    private static boolean matchesStored(CardStateEntity e, CardState state) {
        return e.getPhase() == state.phase()
                && Objects.equals(e.getDue(), state.due())
                && Objects.equals(e.getLastReview(), state.lastReview())
                && Double.compare(e.getStability(), state.stability()) == 0
                && Double.compare(e.getDifficulty(), state.difficulty()) == 0
                && Double.compare(e.getElapsedDays(), state.elapsedDays()) == 0
                && Double.compare(e.getScheduledDays(), state.scheduledDays()) == 0
                && e.getReps() == state.reps()
                && e.getLapses() == state.lapses();
    }

    private DueCardResponse toDueCard(StudyCandidate candidate, Instant now) {
        SchedulingPreview preview = scheduler.schedulePreview(candidate.state(), now);
        Map<Rating, IntervalPreview> intervals = new EnumMap<>(Rating.class);
        for (var e : preview.asMap().entrySet()) {
            CardState next = e.getValue();
            intervals.put(e.getKey(), new IntervalPreview(
                    next.phase(),
                    next.due(),
                    next.scheduledDays(),
                    IntervalFormatter.format(next.scheduledDays())
            ));
        }
        return new DueCardResponse(
                candidate.card().getCardId(),
                candidate.card().getDeckId(),
                CardStateDto.of(candidate.state(), now),
                intervals
        );
    }

    private static String sqlStateOf(Throwable ex) {
        for (Throwable t = ex; t != null; t = (t.getCause() == t) ? null : t.getCause()) {
            if (t instanceof SQLException sql && sql.getSQLState() != null) {
                return sql.getSQLState();
            }
        }
        return null;
    }

    private static int normalizeLimit(Integer limit) {
        if (limit == null) return DueQueueSelector.DEFAULT_LIMIT;
        if (limit < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be positive");
        }
        return Math.min(limit, MAX_LIMIT);
    }

    private record StudyCandidate(ReviewCardEntity card, CardState state) {
    }
}
