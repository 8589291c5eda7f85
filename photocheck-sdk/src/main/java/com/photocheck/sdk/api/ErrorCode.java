package com.photocheck.sdk.api;

/**
 * Standard error codes. Used by capture_error log events and {@link PhotoCheckException}.
 */
public enum ErrorCode {
    PERCEPTION_UNAVAILABLE,
    CONFIG_INVALID,
    DUPLICATE_VALIDATOR,
    VALIDATOR_FAIL,
    STORAGE_FAIL,
    INTERNAL,
    UNKNOWN
}
