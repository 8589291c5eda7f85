package com.photocheck.sample;

import com.photocheck.sdk.api.CaptureState;
import com.photocheck.sdk.api.PhotoCheckException;
import com.photocheck.sdk.api.PhotoCheckSdk;
import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.config.ConfigurationSource;
import com.photocheck.sdk.config.PropertiesConfigurationSource;
import com.photocheck.sdk.detection.PerceptionUnavailableException;
import com.photocheck.sdk.detection.ReplayPerceptionAdapter;
import com.photocheck.sdk.feedback.GuidanceMessage;
import com.photocheck.sdk.report.ReportJson;
import com.photocheck.sdk.session.BoothSession;
import com.photocheck.sdk.session.FrameTick;
import com.photocheck.sdk.storage.InMemoryCaptureStore;
import com.photocheck.sdk.storage.StorageException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Replays recorded booth frames through a capture session.
 *
 * <pre>
 *   java -jar sample-app.jar &lt;frames-dir&gt; [config.properties] [frame-interval-ms]
 * </pre>
 * The directory holds images (png/jpg) plus one perception sidecar JSON per image
 * (same base name). Frames are fed in file-name order with synthetic timestamps.
 * One JSON report line per evaluated frame goes to stdout.
 */
public final class SampleApplication {

    private static final Logger log = LoggerFactory.getLogger(SampleApplication.class);

    private static final long DEFAULT_FRAME_INTERVAL_MS = 100L;

    private SampleApplication() {}

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("usage: SampleApplication <frames-dir> [config.properties] [frame-interval-ms]");
            System.exit(2);
        }
        Path frames = Paths.get(args[0]);
        ConfigurationSource config = args.length > 1
                ? PropertiesConfigurationSource.fromPath(Paths.get(args[1]))
                : PropertiesConfigurationSource.fromDefaults();
        long interval = args.length > 2 ? Long.parseLong(args[2]) : DEFAULT_FRAME_INTERVAL_MS;

        try {
            int code = run(frames, config, interval);
            System.exit(code);
        } catch (PhotoCheckException e) {
            log.error("configuration rejected: {}", e.getMessage());
            System.exit(3);
        } catch (PerceptionUnavailableException | IOException e) {
            log.error("replay failed", e);
            System.exit(1);
        }
    }

    static int run(Path framesDir, ConfigurationSource config, long intervalMs)
            throws IOException, PerceptionUnavailableException {
        ReplayPerceptionAdapter perception = ReplayPerceptionAdapter.fromDirectory(framesDir, "ibug-68");
        InMemoryCaptureStore store = new InMemoryCaptureStore();
        PhotoCheckSdk sdk = PhotoCheckSdk.create(config, perception, store);

        BoothSession session = sdk.openSession();
        session.addListener(tick -> {
            GuidanceMessage top = tick.primaryGuidance();
            if (top != null) {
                log.info("[{}] {}", tick.state.getDisplayMessage(), top.text);
            }
        });

        List<Path> images = listImages(framesDir);
        log.info("replaying {} frames from {}", images.size(), framesDir);
        long ts = 0L;
        for (Path image : images) {
            BufferedImage img = ImageIO.read(image.toFile());
            if (img == null) {
                log.warn("skipping unreadable image {}", image.getFileName());
                continue;
            }
            FrameTick tick = session.onFrame(Frame.of(img, ts, image.getFileName().toString()));
            if (tick.report != null) {
                System.out.println(ReportJson.toJson(tick.report, tick.guidance));
            }
            if (tick.failure instanceof StorageException && session.hasPendingCapture()) {
                retryOnce(session);
            }
            if (tick.state.isTerminal()) break;
            ts += intervalMs;
        }

        CaptureState end = session.getState();
        log.info("session {} ended in {} ({})", session.getSessionId(), end,
                end.getDisplayMessage().toLowerCase(Locale.ROOT));
        if (end == CaptureState.CAPTURED) {
            log.info("captured record {}", session.getCapturedRecord());
            return 0;
        }
        return 1;
    }

    private static void retryOnce(BoothSession session) {
        try {
            session.retryCapture();
        } catch (StorageException e) {
            log.warn("capture still not stored, waiting for a new stable run: {}", e.getMessage());
            session.abandonCapture();
        }
    }

    private static List<Path> listImages(Path dir) throws IOException {
        List<Path> images = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.{png,jpg,jpeg}")) {
            for (Path p : files) images.add(p);
        }
        Collections.sort(images);
        return images;
    }
}
