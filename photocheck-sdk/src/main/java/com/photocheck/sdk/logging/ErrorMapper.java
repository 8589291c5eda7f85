package com.photocheck.sdk.logging;

import com.photocheck.sdk.api.ErrorCode;
import com.photocheck.sdk.api.PhotoCheckException;
import com.photocheck.sdk.detection.PerceptionUnavailableException;
import com.photocheck.sdk.storage.StorageException;

/**
 * Maps a throwable and the place it surfaced to an {@link ErrorCode}.
 */
public final class ErrorMapper {

    private ErrorMapper() {}

    /**
     * @param t       exception
     * @param context optional location (where), may be null
     * @return mapped ErrorCode
     */
    public static ErrorCode map(Throwable t, String context) {
        if (t instanceof PhotoCheckException) {
            return ((PhotoCheckException) t).getErrorCode();
        }
        if (t instanceof PerceptionUnavailableException) return ErrorCode.PERCEPTION_UNAVAILABLE;
        if (t instanceof StorageException) return ErrorCode.STORAGE_FAIL;
        if (t.getCause() != null) return map(t.getCause(), context);
        if ("validator".equals(context)) return ErrorCode.VALIDATOR_FAIL;
        return ErrorCode.UNKNOWN;
    }

    public static ErrorCode map(Throwable t) {
        return map(t, null);
    }
}
