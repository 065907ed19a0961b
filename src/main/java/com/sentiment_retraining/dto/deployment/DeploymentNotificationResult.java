package com.sentiment_retraining.dto.deployment;

import com.sentiment_retraining.enumeration.DeploymentNotificationStatusEnum;

public record DeploymentNotificationResult(DeploymentNotificationStatusEnum status, String reason) {

    public static DeploymentNotificationResult sent() {
        return new DeploymentNotificationResult(DeploymentNotificationStatusEnum.SENT, null);
    }

    public static DeploymentNotificationResult disabled() {
        return new DeploymentNotificationResult(DeploymentNotificationStatusEnum.DISABLED, "CD trigger disabled");
    }

    public static DeploymentNotificationResult failed(String reason) {
        return new DeploymentNotificationResult(DeploymentNotificationStatusEnum.FAILED, reason);
    }

    public boolean isSent() {
        return status == DeploymentNotificationStatusEnum.SENT;
    }
}
