package app.sage.core.review.controller.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record StudySessionStartResponse(
        UUID sessionId,
        UUID deckId,
        Instant startedAt,
        List<DueCardResponse> cards,
        int totalDue
) {}
