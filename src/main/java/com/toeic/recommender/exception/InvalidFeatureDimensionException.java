package com.toeic.recommender.exception;

/**
 * An item's feature vector does not match the learner profile dimension. Vectors are never padded or
 * truncated to hide this.
 */
public class InvalidFeatureDimensionException extends RecommendationException {

    private final String itemId;
    private final int expected;
    private final int actual;

    public InvalidFeatureDimensionException(String itemId, int expected, int actual) {
        super("Item " + itemId + " has feature dimension " + actual + ", expected " + expected);
        this.itemId = itemId;
        this.expected = expected;
        this.actual = actual;
    }

    public String getItemId() {
        return itemId;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }

    @Override
    public String getCode() {
        return "INVALID_FEATURE_DIMENSION";
    }
}
