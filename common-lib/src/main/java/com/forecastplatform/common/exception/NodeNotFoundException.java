package com.forecastplatform.common.exception;

public class NodeNotFoundException extends TreeStoreException {

    public NodeNotFoundException(String nodeId) {
        super(nodeId, "Scenario node not found. id=" + nodeId);
    }
}
