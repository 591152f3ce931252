package app.sage.core.review.domain;

import java.util.Locale;

public enum Rating {
    AGAIN(1), HARD(2), GOOD(3), EASY(4);

    private final int code;
    Rating(int code) { this.code = code; }
    public int code() { return code; }

    public static Rating fromCode(int code) {
        for (Rating r : values()) {
            if (r.code == code) return r;
        }
        throw new InvalidRatingException("Rating must be between 1 and 4, got " + code);
    }

    /**
     * Accepts a numeric code ("1".."4") or a rating name in any case.
     */
    public static Rating fromString(String v) {
        if (v == null || v.isBlank()) {
            throw new InvalidRatingException("Rating is required");
        }
        String trimmed = v.trim();
        if (trimmed.length() == 1 && trimmed.charAt(0) >= '1' && trimmed.charAt(0) <= '4') {
            return fromCode(trimmed.charAt(0) - '0');
        }
        try {
            return Rating.valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRatingException("Unsupported rating: " + v);
        }
    }
}
