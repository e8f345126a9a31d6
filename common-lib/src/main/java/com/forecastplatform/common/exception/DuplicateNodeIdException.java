package com.forecastplatform.common.exception;

public class DuplicateNodeIdException extends TreeStoreException {

    public DuplicateNodeIdException(String nodeId) {
        super(nodeId, "Scenario node already registered. id=" + nodeId);
    }
}
