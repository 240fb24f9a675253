package com.eduhub.scheduling.domain.model;

/**
 * Closed set of reasons an operator may give when cancelling sessions in bulk.
 */
public enum CancelReasonCode {
    WEATHER,
    TUTOR_UNAVAILABLE,
    HOLIDAY,
    LOW_ENROLLMENT,
    OTHER
}
