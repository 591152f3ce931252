package app.sage.core.review.controller.dto;

import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.Rating;

import java.time.Instant;

public record ReviewHistoryItem(
        Rating rating,
        CardPhase phaseBefore,
        CardPhase phaseAfter,
        double elapsedDays,
        double scheduledDays,
        int reviewTimeMs,
        Instant reviewedAt
) {}
