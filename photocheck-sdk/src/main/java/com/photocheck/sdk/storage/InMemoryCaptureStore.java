package com.photocheck.sdk.storage;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.quality.ValidationReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps captures in memory. Used by the sample app and tests.
 */
public final class InMemoryCaptureStore implements StorageCollaborator {

    public static final class StoredCapture {
        public final RecordId         id;
        public final Frame            frame;
        public final ValidationReport report;

        StoredCapture(RecordId id, Frame frame, ValidationReport report) {
            this.id     = id;
            this.frame  = frame;
            this.report = report;
        }
    }

    private final Map<RecordId, StoredCapture> captures = new LinkedHashMap<>();
    private int sequence;

    @Override
    public synchronized RecordId persist(Frame frame, ValidationReport report) throws StorageException {
        if (frame == null || report == null) {
            throw new StorageException("frame and report are required");
        }
        RecordId id = new RecordId(String.format("capture-%04d", ++sequence));
        captures.put(id, new StoredCapture(id, frame, report));
        return id;
    }

    public synchronized StoredCapture get(RecordId id) {
        return captures.get(id);
    }

    public synchronized List<StoredCapture> all() {
        return Collections.unmodifiableList(new ArrayList<>(captures.values()));
    }

    public synchronized int size() {
        return captures.size();
    }
}
