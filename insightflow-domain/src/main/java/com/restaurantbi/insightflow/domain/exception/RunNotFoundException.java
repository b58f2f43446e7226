package com.restaurantbi.insightflow.domain.exception;

public class RunNotFoundException extends InsightflowException {

    public RunNotFoundException(String runId) {
        super(ErrorCode.RUN_NOT_FOUND, "Workflow run not found: " + runId);
    }
}
