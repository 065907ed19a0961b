package com.sentiment_retraining.enumeration;

public enum PipelineStateEnum {
    PENDING,
    INGEST,
    VALIDATE,
    DECIDE,
    SKIP,
    PREPROCESS,
    SPLIT,
    TRAIN,
    EVALUATE,
    REGISTER,
    NOTIFY,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
