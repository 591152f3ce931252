package app.sage.core.review.controller.dto;

import java.util.UUID;

public record EndSessionRequest(
        UUID sessionId,
        Integer cardsStudied,
        Integer cardsCorrect,
        Long timeSpentMs
) {}
