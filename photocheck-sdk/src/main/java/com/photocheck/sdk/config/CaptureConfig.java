package com.photocheck.sdk.config;

import com.photocheck.sdk.api.ValidatorConfigException;

import java.util.ArrayList;
import java.util.List;

/**
 * Capture loop settings: stability window, session timeout, frame stride, storage retries.
 */
public final class CaptureConfig {

    /** Consecutive passing reports required before auto-capture (N). */
    public final int  stableFramesRequired;
    /** The last N passes must fit in this window (T, ms). */
    public final long stabilityWindowMs;
    /** Session timeout measured from the first frame (ms). */
    public final long sessionTimeoutMs;
    /** Evaluate every K-th frame; 1 = every frame. */
    public final int  frameStride;
    /** Reports kept in the session history. */
    public final int  reportHistorySize;
    /** Extra persist attempts after the first failure. */
    public final int  storageRetries;
    public final long storageRetryBackoffMs;

    private CaptureConfig(Builder b) {
        this.stableFramesRequired  = b.stableFramesRequired;
        this.stabilityWindowMs     = b.stabilityWindowMs;
        this.sessionTimeoutMs      = b.sessionTimeoutMs;
        this.frameStride           = b.frameStride;
        this.reportHistorySize     = b.reportHistorySize;
        this.storageRetries        = b.storageRetries;
        this.storageRetryBackoffMs = b.storageRetryBackoffMs;
    }

    public static CaptureConfig defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        int  stableFramesRequired  = 5;
        long stabilityWindowMs     = 1_500L;
        long sessionTimeoutMs      = 30_000L;
        int  frameStride           = 1;
        int  reportHistorySize     = 30;
        int  storageRetries        = 3;
        long storageRetryBackoffMs = 0L;

        public Builder stableFramesRequired(int v)    { stableFramesRequired = v;  return this; }
        public Builder stabilityWindowMs(long v)      { stabilityWindowMs = v;     return this; }
        public Builder sessionTimeoutMs(long v)       { sessionTimeoutMs = v;      return this; }
        public Builder frameStride(int v)             { frameStride = v;           return this; }
        public Builder reportHistorySize(int v)       { reportHistorySize = v;     return this; }
        public Builder storageRetries(int v)          { storageRetries = v;        return this; }
        public Builder storageRetryBackoffMs(long v)  { storageRetryBackoffMs = v; return this; }

        public CaptureConfig build() {
            List<String> problems = new ArrayList<>();
            if (stableFramesRequired < 1) problems.add("capture.stableFrames must be >= 1");
            if (stabilityWindowMs < 0)    problems.add("capture.stabilityWindowMs must be >= 0");
            if (sessionTimeoutMs <= 0)    problems.add("capture.sessionTimeoutMs must be > 0");
            if (frameStride < 1)          problems.add("capture.frameStride must be >= 1");
            if (reportHistorySize < 1)    problems.add("capture.historySize must be >= 1");
            if (storageRetries < 0)       problems.add("storage.retries must be >= 0");
            if (storageRetryBackoffMs < 0) problems.add("storage.retryBackoffMs must be >= 0");
            if (!problems.isEmpty()) {
                throw new ValidatorConfigException("Invalid capture settings", problems);
            }
            return new CaptureConfig(this);
        }
    }
}
