package com.forecastplatform.common.exception;

/**
 * Misuse of the tree store. Signals broken bookkeeping rather than an unreliable
 * collaborator, so it is allowed to terminate a generation session.
 */
public abstract class TreeStoreException extends IllegalStateException {

    private final String nodeId;

    protected TreeStoreException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
