package com.forecastplatform.common.exception;

/**
 * A probability or depth invariant could not be established, e.g. a sibling set that
 * will not normalize because its values are not finite.
 */
public class InvariantViolationException extends NodeProcessingException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
