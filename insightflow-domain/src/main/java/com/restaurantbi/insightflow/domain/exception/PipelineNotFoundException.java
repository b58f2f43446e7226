package com.restaurantbi.insightflow.domain.exception;

public class PipelineNotFoundException extends InsightflowException {

    public PipelineNotFoundException(String pipelineId) {
        super(ErrorCode.PIPELINE_NOT_FOUND, "Pipeline not found: " + pipelineId);
    }
}
