package app.sage.core.review.controller;

import app.sage.core.review.controller.dto.DueCardResponse;
import app.sage.core.review.controller.dto.DueCardsResponse;
import app.sage.core.review.controller.dto.EndSessionRequest;
import app.sage.core.review.controller.dto.ReviewAnswerResponse;
import app.sage.core.review.controller.dto.ReviewHistoryItem;
import app.sage.core.review.controller.dto.StartSessionRequest;
import app.sage.core.review.controller.dto.StudySessionEndResponse;
import app.sage.core.review.controller.dto.StudySessionStartResponse;
import app.sage.core.review.controller.dto.StudyStatsResponse;
import app.sage.core.review.controller.dto.SubmitReviewRequest;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.service.ReviewService;
import app.sage.core.review.service.ReviewStatsService;
import app.sage.core.review.service.StudySessionService;
import app.sage.core.security.CurrentUserProvider;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/study")
public class StudyController {

    private final CurrentUserProvider currentUserProvider;
    private final ReviewService reviewService;
    private final ReviewStatsService statsService;
    private final StudySessionService sessionService;

    public StudyController(CurrentUserProvider currentUserProvider,
                           ReviewService reviewService,
                           ReviewStatsService statsService,
                           StudySessionService sessionService) {
        this.currentUserProvider = currentUserProvider;
        this.reviewService = reviewService;
        this.statsService = statsService;
        this.sessionService = sessionService;
    }

    // GET /api/core/study/due?deckId=...&limit=20
    @GetMapping("/due")
    public DueCardsResponse due(@AuthenticationPrincipal Jwt jwt,
                                @RequestParam(required = false) UUID deckId,
                                @RequestParam(required = false) Integer limit) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return reviewService.dueCards(userId, deckId, limit);
    }

    // GET /api/core/study/cards/{cardId}/preview
    @GetMapping("/cards/{cardId}/preview")
    public DueCardResponse preview(@AuthenticationPrincipal Jwt jwt,
                                   @PathVariable UUID cardId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return reviewService.preview(userId, cardId);
    }

    // GET /api/core/study/cards/{cardId}/history
    @GetMapping("/cards/{cardId}/history")
    public List<ReviewHistoryItem> history(@AuthenticationPrincipal Jwt jwt,
                                           @PathVariable UUID cardId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return reviewService.history(userId, cardId);
    }

    // POST /api/core/study/review
    @PostMapping("/review")
    public ReviewAnswerResponse review(@AuthenticationPrincipal Jwt jwt,
                                       @RequestBody SubmitReviewRequest req) {
        UUID userId = currentUserProvider.getUserId(jwt);
        if (req.cardId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "cardId is required");
        }
        Rating rating = Rating.fromString(req.rating());
        return reviewService.answer(userId, req.cardId(), rating, req.reviewTimeMs());
    }

    // GET /api/core/study/stats?deckId=...&timeZone=Europe/Berlin
    @GetMapping("/stats")
    public StudyStatsResponse stats(@AuthenticationPrincipal Jwt jwt,
                                    @RequestParam(required = false) UUID deckId,
                                    @RequestParam(required = false) String timeZone) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return statsService.stats(userId, deckId, timeZone);
    }

    // POST /api/core/study/session/start
    @PostMapping("/session/start")
    public StudySessionStartResponse startSession(@AuthenticationPrincipal Jwt jwt,
                                                  @RequestBody StartSessionRequest req) {
        UUID userId = currentUserProvider.getUserId(jwt);
        if (req.deckId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "deckId is required");
        }
        return sessionService.startSession(userId, req.deckId());
    }

    // POST /api/core/study/session/end?timeZone=Europe/Berlin
    @PostMapping("/session/end")
    public StudySessionEndResponse endSession(@AuthenticationPrincipal Jwt jwt,
                                              @RequestParam(required = false) String timeZone,
                                              @RequestBody EndSessionRequest req) {
        UUID userId = currentUserProvider.getUserId(jwt);
        if (req.sessionId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "sessionId is required");
        }
        return sessionService.endSession(userId, req.sessionId(), req.cardsStudied(), req.cardsCorrect(),
                req.timeSpentMs(), timeZone);
    }
}
