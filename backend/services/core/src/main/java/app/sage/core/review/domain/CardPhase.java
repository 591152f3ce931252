package app.sage.core.review.domain;

public enum CardPhase {
    NEW, LEARNING, REVIEW, RELEARNING;

    public boolean isLearningStep() {
        return this == LEARNING || this == RELEARNING;
    }
}
