package com.photocheck.sdk.storage;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.logging.CaptureErrorLogger;
import com.photocheck.sdk.logging.SafeLogger;
import com.photocheck.sdk.quality.ValidationReport;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists a capture through the collaborator with bounded retries.
 * Total attempts = 1 + retries. Each failed attempt is logged as capture_error;
 * the last failure is rethrown.
 */
public final class CapturePersister {

    private static final String TAG = "CapturePersister";

    private final StorageCollaborator storage;
    private final int  retries;
    private final long backoffMs;

    public CapturePersister(StorageCollaborator storage, int retries, long backoffMs) {
        if (storage == null) {
            throw new IllegalArgumentException("storage must not be null");
        }
        this.storage   = storage;
        this.retries   = Math.max(0, retries);
        this.backoffMs = Math.max(0L, backoffMs);
    }

    public RecordId persist(Frame frame, ValidationReport report) throws StorageException {
        StorageException last = null;
        for (int attempt = 1; attempt <= retries + 1; attempt++) {
            try {
                RecordId id = storage.persist(frame, report);
                if (attempt > 1) {
                    SafeLogger.i(TAG, "persisted on attempt " + attempt);
                }
                return id;
            } catch (StorageException e) {
                last = e;
                Map<String, Object> ctx = new LinkedHashMap<>();
                ctx.put("attempt", attempt);
                ctx.put("maxAttempts", retries + 1);
                ctx.put("frame", frame.sourceId);
                CaptureErrorLogger.log(e, "storage", ctx);
                if (attempt <= retries) {
                    pause();
                }
            }
        }
        throw last;
    }

    private void pause() throws StorageException {
        if (backoffMs == 0L) return;
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("interrupted while waiting to retry", e);
        }
    }
}
