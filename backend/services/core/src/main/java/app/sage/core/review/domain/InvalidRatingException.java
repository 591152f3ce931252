package app.sage.core.review.domain;

public class InvalidRatingException extends IllegalArgumentException {

    public InvalidRatingException(String message) {
        super(message);
    }
}
