package app.sage.core.review.controller.dto;

import app.sage.core.review.domain.Rating;

import java.util.Map;
import java.util.UUID;

public record DueCardResponse(
        UUID cardId,
        UUID deckId,
        CardStateDto state,
        Map<Rating, IntervalPreview> intervals
) {}
