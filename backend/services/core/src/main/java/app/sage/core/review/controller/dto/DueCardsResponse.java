package app.sage.core.review.controller.dto;

import java.util.List;

public record DueCardsResponse(
        List<DueCardResponse> cards,
        int count
) {}
