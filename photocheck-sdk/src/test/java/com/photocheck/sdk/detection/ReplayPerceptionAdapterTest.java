package com.photocheck.sdk.detection;

import com.photocheck.sdk.camera.Frame;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class ReplayPerceptionAdapterTest {

    @Rule public TemporaryFolder tmp = new TemporaryFolder();

    private static Frame frame(String sourceId) {
        return Frame.of(new BufferedImage(20, 20, BufferedImage.TYPE_INT_RGB), 0L, sourceId);
    }

    private static ReplayPerceptionAdapter fixture() throws Exception {
        try (InputStream in = ReplayPerceptionAdapterTest.class.getClassLoader()
                .getResourceAsStream("perception-records.json")) {
            return ReplayPerceptionAdapter.fromStream(in, "ibug-68");
        }
    }

    private static InputStream json(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void fromStream_readsFaceRecord() throws Exception {
        ReplayPerceptionAdapter adapter = fixture();
        assertEquals(2, adapter.size());

        PerceptionResult r = adapter.detect(frame("frame_001.png"));

        assertTrue(r.isFaceDetected());
        DetectedFace face = r.asFace();
        assertEquals(new BoundingBox(70f, 60f, 130f, 140f), face.boundingBox);
        assertEquals(2, face.landmarkCount());
        assertEquals(1f, face.landmark(0).visibility, 0f);
        assertEquals(0.4f, face.landmark(1).visibility, 1e-6f);
        assertEquals(0.93f, face.expressionScore(DetectedFace.NEUTRAL), 1e-6f);
        assertEquals(3.5f, face.headPose.yaw, 0f);
        assertEquals("ibug-68", face.modelVersion);
    }

    @Test
    public void exactSourceMatch_andRecordModelVersionWins() throws Exception {
        PerceptionResult r = fixture().detect(frame("frame_002.png"));

        assertFalse(r.isFaceDetected());
        assertEquals("older-model", r.modelVersion);
    }

    @Test
    public void unknownFrame_isNoFace() throws Exception {
        PerceptionResult r = fixture().detect(frame("frame_999.png"));

        assertEquals(new NoFaceDetected("ibug-68"), r);
    }

    @Test(expected = PerceptionUnavailableException.class)
    public void frameWithoutSource_cannotBeReplayed() throws Exception {
        fixture().detect(Frame.ofLuma(2, 2, new int[4], 0L));
    }

    @Test(expected = PerceptionUnavailableException.class)
    public void malformedJson_isUnavailable() throws Exception {
        ReplayPerceptionAdapter.fromStream(json("{not json"), "ibug-68");
    }

    @Test(expected = PerceptionUnavailableException.class)
    public void faceWithoutBox_isUnavailable() throws Exception {
        ReplayPerceptionAdapter.fromStream(json("[{\"source\":\"x\",\"face\":true}]"), "ibug-68");
    }

    @Test(expected = PerceptionUnavailableException.class)
    public void arrayRecordWithoutSource_isUnavailable() throws Exception {
        ReplayPerceptionAdapter.fromStream(json("[{\"face\":false}]"), "ibug-68");
    }

    @Test
    public void fromDirectory_keysByFileNameWhenSourceMissing() throws Exception {
        Path dir = tmp.newFolder("frames").toPath();
        Files.write(dir.resolve("shot_a.json"),
                "{\"face\":true,\"boundingBox\":{\"left\":1,\"top\":2,\"right\":11,\"bottom\":22}}"
                        .getBytes(StandardCharsets.UTF_8));
        Files.write(dir.resolve("other.json"),
                "{\"source\":\"shot_b.jpg\",\"face\":false}".getBytes(StandardCharsets.UTF_8));
        Files.write(dir.resolve("shot_a.png"), new byte[]{1, 2, 3});

        ReplayPerceptionAdapter adapter = ReplayPerceptionAdapter.fromDirectory(dir, "ibug-68");

        assertEquals(2, adapter.size());
        assertTrue(adapter.detect(frame("shot_a.png")).isFaceDetected());
        assertFalse(adapter.detect(frame("shot_b.jpg")).isFaceDetected());
    }

    @Test(expected = PerceptionUnavailableException.class)
    public void fromDirectory_missingDirectory() throws Exception {
        ReplayPerceptionAdapter.fromDirectory(tmp.getRoot().toPath().resolve("nope"), "ibug-68");
    }
}
