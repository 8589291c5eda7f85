package com.photocheck.sdk.logging;

import com.photocheck.sdk.api.ErrorCode;
import com.photocheck.sdk.api.PhotoCheckException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Standard capture_error JSON event. Never swallows: callers still rethrow or
 * convert the failure themselves.
 */
public final class CaptureErrorLogger {

    private static final String TAG = "CaptureError";
    private static final String EVENT = "capture_error";

    private CaptureErrorLogger() {}

    /**
     * One capture_error line.
     *
     * @param errorCode required
     * @param message   short exception message
     * @param context   optional: where, validator, state, sessionId, attempt ...
     */
    public static void log(ErrorCode errorCode, String message, Map<String, Object> context) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("errorCode", errorCode.name());
        map.put("message", message != null ? message : "");
        if (context != null) map.putAll(context);
        SafeLogger.e(TAG, CaptureEventLogger.toJson(EVENT, map));
    }

    /** Throwable based: code decided by {@link ErrorMapper}. */
    public static void log(Throwable t, String where, Map<String, Object> context) {
        ErrorCode code = ErrorMapper.map(t, where);
        String msg = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        Map<String, Object> ctx = new LinkedHashMap<>();
        if (context != null) ctx.putAll(context);
        if (where != null) ctx.put("where", where);
        if (t instanceof PhotoCheckException && ((PhotoCheckException) t).getWhere() != null) {
            ctx.put("where", ((PhotoCheckException) t).getWhere());
        }
        ctx.put("exception", t.getClass().getSimpleName());
        log(code, msg, ctx);
    }

    public static void log(Throwable t, String where) {
        log(t, where, null);
    }
}
