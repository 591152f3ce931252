package app.sage.core.review.controller.dto;

import java.util.UUID;

public record SubmitReviewRequest(
        UUID cardId,
        String rating,
        Integer reviewTimeMs
) {}
