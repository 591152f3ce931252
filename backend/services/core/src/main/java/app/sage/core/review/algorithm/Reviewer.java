package app.sage.core.review.algorithm;

import app.sage.core.review.domain.CardState;
import app.sage.core.review.domain.InvalidRatingException;
import app.sage.core.review.domain.Rating;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Produces the authoritative next state for a rating by picking the matching branch of
 * {@link FsrsScheduler#schedulePreview}, so previews and committed reviews cannot diverge.
 * Persisting the result is the caller's job.
 */
@Component
public class Reviewer {

    private final FsrsScheduler scheduler;

    public Reviewer(FsrsScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public CardState applyReview(CardState state, Rating rating, Instant now) {
        if (rating == null) {
            throw new InvalidRatingException("Rating is required");
        }
        return scheduler.schedulePreview(state, now).forRating(rating);
    }

    public CardState applyReview(CardState state, int ratingCode, Instant now) {
        return applyReview(state, Rating.fromCode(ratingCode), now);
    }

    public CardState applyReview(Optional<CardState> stored, Instant createdAt, Rating rating, Instant now) {
        return applyReview(CardState.orNew(stored, createdAt), rating, now);
    }
}
