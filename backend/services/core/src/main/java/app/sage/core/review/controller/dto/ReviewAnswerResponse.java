package app.sage.core.review.controller.dto;

import app.sage.core.review.domain.Rating;

import java.time.Instant;
import java.util.UUID;

public record ReviewAnswerResponse(
        UUID cardId,
        Rating rating,
        CardStateDto cardState,
        Instant nextDue,
        String interval
) {}
