package com.sentiment_retraining.enumeration;

public enum DeploymentNotificationStatusEnum {
    SENT,
    DISABLED,
    FAILED
}
