package com.photocheck.sdk.detection;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.logging.SafeLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Perception adapter that replays recorded results instead of running a model.
 * Results are keyed by {@link Frame#sourceId}; the lookup also tries the id without
 * its file extension, so "frame_001.png" finds a record stored for "frame_001".
 * A frame with no record is reported as {@link NoFaceDetected}.
 */
public final class ReplayPerceptionAdapter implements PerceptionAdapter {

    private static final String TAG = "ReplayPerception";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, PerceptionResult> results;
    private final String modelVersion;

    public ReplayPerceptionAdapter(Map<String, PerceptionResult> results, String modelVersion) {
        this.results      = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.modelVersion = modelVersion;
    }

    /**
     * Load every {@code *.json} sidecar in the directory. A record without "source"
     * is keyed by its file name minus ".json".
     */
    public static ReplayPerceptionAdapter fromDirectory(Path dir, String modelVersion)
            throws PerceptionUnavailableException {
        Map<String, PerceptionResult> map = new LinkedHashMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : files) {
                PerceptionRecord rec;
                try (InputStream in = Files.newInputStream(file)) {
                    rec = MAPPER.readValue(in, PerceptionRecord.class);
                }
                String key = rec.source != null ? rec.source : stripExtension(file.getFileName().toString());
                map.put(key, toResult(rec, modelVersion));
            }
        } catch (IOException e) {
            throw new PerceptionUnavailableException("cannot read perception records in " + dir, e);
        }
        SafeLogger.i(TAG, "loaded " + map.size() + " perception records from " + dir);
        return new ReplayPerceptionAdapter(map, modelVersion);
    }

    /** Load a JSON array of records, each with a "source" key. */
    public static ReplayPerceptionAdapter fromStream(InputStream in, String modelVersion)
            throws PerceptionUnavailableException {
        List<PerceptionRecord> records;
        try {
            records = MAPPER.readValue(in, new TypeReference<List<PerceptionRecord>>() {});
        } catch (IOException e) {
            throw new PerceptionUnavailableException("cannot parse perception records", e);
        }
        Map<String, PerceptionResult> map = new LinkedHashMap<>();
        for (PerceptionRecord rec : records) {
            if (rec.source == null) {
                throw new PerceptionUnavailableException("perception record without source");
            }
            map.put(rec.source, toResult(rec, modelVersion));
        }
        return new ReplayPerceptionAdapter(map, modelVersion);
    }

    @Override
    public PerceptionResult detect(Frame frame) throws PerceptionUnavailableException {
        if (frame.sourceId == null) {
            throw new PerceptionUnavailableException("replay needs a frame source id");
        }
        PerceptionResult result = results.get(frame.sourceId);
        if (result == null) {
            result = results.get(stripExtension(frame.sourceId));
        }
        if (result == null) {
            SafeLogger.d(TAG, "no record for " + frame.sourceId + ", reporting no face");
            return new NoFaceDetected(modelVersion);
        }
        return result;
    }

    public int size() { return results.size(); }

    private static PerceptionResult toResult(PerceptionRecord rec, String modelVersion)
            throws PerceptionUnavailableException {
        try {
            return rec.toResult(modelVersion);
        } catch (IllegalArgumentException e) {
            throw new PerceptionUnavailableException("invalid perception record " + rec.source, e);
        }
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
