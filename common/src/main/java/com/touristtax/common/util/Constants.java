package com.touristtax.common.util;

/**
 * Common constants used across all services.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String API_V1 = "/api/v1";

    public static final String LOCK_PREFIX = "lock:reservation:";

    public static final String ERROR_VALIDATION = "VALIDATION_ERROR";
}
