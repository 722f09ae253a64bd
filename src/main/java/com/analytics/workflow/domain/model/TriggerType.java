package com.analytics.workflow.domain.model;

public enum TriggerType {
    MANUAL,
    SCHEDULED
}
