package com.forecastplatform.common.exception;

/**
 * Failure confined to the expansion of a single scenario node.
 *
 * <p>The orchestrator catches every subtype, marks the node {@code FAILED} and carries on
 * with the rest of the tree. Store-level defects use {@link TreeStoreException} instead
 * and are never caught per node.
 */
public abstract class NodeProcessingException extends RuntimeException {

    protected NodeProcessingException(String message) {
        super(message);
    }

    protected NodeProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
