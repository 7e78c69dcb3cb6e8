package com.inflationdata.ipc.exception;

/**
 * A division-level classification that the nature table does not know.
 * Signals taxonomy drift in the upstream source.
 */
public class UnknownClassificationException extends RuntimeException {

    private final String classification;

    public UnknownClassificationException(String categoryName, String classification) {
        super("No nature defined for " + categoryName + " / " + classification);
        this.classification = classification;
    }

    public String getClassification() {
        return classification;
    }
}
