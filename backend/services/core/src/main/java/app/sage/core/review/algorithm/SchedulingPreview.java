package app.sage.core.review.algorithm;

import app.sage.core.review.domain.CardState;
import app.sage.core.review.domain.Rating;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record SchedulingPreview(
        CardState again,
        CardState hard,
        CardState good,
        CardState easy
) {

    public CardState forRating(Rating rating) {
        return switch (rating) {
            case AGAIN -> again;
            case HARD -> hard;
            case GOOD -> good;
            case EASY -> easy;
        };
    }

    public Map<Rating, CardState> asMap() {
        Map<Rating, CardState> out = new EnumMap<>(Rating.class);
        for (Rating r : Rating.values()) {
            out.put(r, forRating(r));
        }
        return Collections.unmodifiableMap(out);
    }
}
