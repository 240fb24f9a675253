package com.eduhub.scheduling.domain.model;

public enum SessionStatus {
    SCHEDULED,
    CANCELLED
}
