package com.forecastplatform.common.exception;

/** A synthesized candidate set is malformed or out of range. */
public class ScenarioValidationException extends NodeProcessingException {

    public ScenarioValidationException(String message) {
        super(message);
    }
}
