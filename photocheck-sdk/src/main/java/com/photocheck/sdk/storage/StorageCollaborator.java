package com.photocheck.sdk.storage;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.quality.ValidationReport;

/**
 * Receives the committed frame and the report that approved it.
 * Record format and durability belong to the implementation.
 */
public interface StorageCollaborator {

    RecordId persist(Frame frame, ValidationReport report) throws StorageException;
}
