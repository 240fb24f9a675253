package com.eduhub.common.util;

/**
 * Common constants used across modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String ACTOR_HEADER = "X-Actor-Id";

    public static final String ISO_DATE_PATTERN = "^\\d{4}-\\d{2}-\\d{2}$";
    public static final String LOCAL_TIME_PATTERN = "^(?:[01]\\d|2[0-3]):[0-5]\\d$";
}
