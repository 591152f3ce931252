package app.sage.core.review.controller.dto;

import app.sage.core.review.domain.CardPhase;

import java.time.Instant;

public record IntervalPreview(
        CardPhase phase,
        Instant nextReviewAt,
        double scheduledDays,
        String display
) {}
