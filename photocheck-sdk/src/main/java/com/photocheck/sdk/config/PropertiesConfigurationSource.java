package com.photocheck.sdk.config;

import com.photocheck.sdk.api.ValidatorConfigException;
import com.photocheck.sdk.feedback.GuidanceCatalog;
import com.photocheck.sdk.logging.SafeLogger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * {@link ConfigurationSource} over a {@code .properties} file.
 * <p>
 * Every threshold key is required. Capture keys are optional. Guidance overrides use
 * {@code guidance.priority.<CODE>} and {@code guidance.message.<CODE>}.
 * The SDK ships a complete file as {@value #DEFAULT_RESOURCE}.
 */
public final class PropertiesConfigurationSource implements ConfigurationSource {

    public static final String DEFAULT_RESOURCE = "photocheck-defaults.properties";

    private static final String TAG = "Config";
    private static final String PRIORITY_PREFIX = "guidance.priority.";
    private static final String MESSAGE_PREFIX  = "guidance.message.";

    private final Properties props;
    private final String     origin;

    public PropertiesConfigurationSource(Properties props, String origin) {
        this.props  = new Properties();
        this.props.putAll(props);
        this.origin = origin;
    }

    public static PropertiesConfigurationSource fromDefaults() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws ValidatorConfigException when the resource is missing or unreadable
     */
    public static PropertiesConfigurationSource fromClasspath(String resource) {
        ClassLoader cl = PropertiesConfigurationSource.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ValidatorConfigException("Configuration not found",
                        Collections.singletonList("classpath:" + resource));
            }
            return new PropertiesConfigurationSource(read(in), "classpath:" + resource);
        } catch (IOException e) {
            throw new ValidatorConfigException("Cannot read classpath:" + resource, e);
        }
    }

    /**
     * @throws ValidatorConfigException when the file is missing or unreadable
     */
    public static PropertiesConfigurationSource fromPath(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ValidatorConfigException("Configuration not found",
                    Collections.singletonList(path.toString()));
        }
        try (InputStream in = Files.newInputStream(path)) {
            return new PropertiesConfigurationSource(read(in), path.toString());
        } catch (IOException e) {
            throw new ValidatorConfigException("Cannot read " + path, e);
        }
    }

    private static Properties read(InputStream in) throws IOException {
        Properties p = new Properties();
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            p.load(r);
        }
        return p;
    }

    @Override
    public ValidatorConfig loadThresholds() {
        KeyReader r = new KeyReader(true);
        ValidatorConfig.Builder b = ValidatorConfig.builder()
                .brightnessMean(r.f("brightness.mean.min"), r.f("brightness.mean.max"))
                .brightnessStd(r.f("brightness.std.min"), r.f("brightness.std.max"))
                .sharpnessMin(r.f("sharpness.min"))
                .sharpnessPadRatio(r.f("sharpness.padRatio"))
                .faceCenterTolerance(r.f("facePosition.centerTolerance"))
                .faceHeightRatio(r.f("facePosition.heightRatio.min"), r.f("facePosition.heightRatio.max"))
                .headPoseMaxDeg(r.f("facePosition.yawMaxDeg"), r.f("facePosition.pitchMaxDeg"),
                        r.f("facePosition.rollMaxDeg"))
                .neutralMin(r.f("facialExpression.neutralMin"))
                .mouthOpenMaxPx(r.f("facialExpression.mouthOpenMaxPx"))
                .eyeVisibilityMin(r.f("eyeVisibility.min"))
                .reflectionLumaMin(r.i("reflection.lumaMin"))
                .reflectionMinClusterPx(r.i("reflection.minClusterPx"))
                .reflectionMaxRatio(r.f("reflection.maxRatio"))
                .reflectionEyePadRatio(r.f("reflection.eyePadRatio"))
                .shadowMaxAsymmetry(r.f("shadow.maxAsymmetry"))
                .backgroundEnabled(r.bool("background.enabled"))
                .backgroundStdMax(r.f("background.stdMax"))
                .backgroundMeanMin(r.f("background.meanMin"))
                .headwearEnabled(r.bool("headwear.enabled"))
                .headwearSkinMin(r.f("headwear.skinMin"))
                .headwearDarkMax(r.f("headwear.darkMax"));
        r.throwIfProblems("Invalid validator thresholds in " + origin);
        ValidatorConfig config = b.build();
        SafeLogger.i(TAG, "thresholds loaded from " + origin);
        return config;
    }

    @Override
    public CaptureConfig loadCaptureConfig() {
        KeyReader r = new KeyReader(false);
        CaptureConfig.Builder b = CaptureConfig.builder();
        if (has("capture.stableFrames"))      b.stableFramesRequired(r.i("capture.stableFrames"));
        if (has("capture.stabilityWindowMs")) b.stabilityWindowMs(r.l("capture.stabilityWindowMs"));
        if (has("capture.sessionTimeoutMs"))  b.sessionTimeoutMs(r.l("capture.sessionTimeoutMs"));
        if (has("capture.frameStride"))       b.frameStride(r.i("capture.frameStride"));
        if (has("capture.historySize"))       b.reportHistorySize(r.i("capture.historySize"));
        if (has("storage.retries"))           b.storageRetries(r.i("storage.retries"));
        if (has("storage.retryBackoffMs"))    b.storageRetryBackoffMs(r.l("storage.retryBackoffMs"));
        r.throwIfProblems("Invalid capture settings in " + origin);
        return b.build();
    }

    @Override
    public GuidanceCatalog loadGuidanceCatalog() {
        KeyReader r = new KeyReader(false);
        GuidanceCatalog.Builder b = GuidanceCatalog.defaults().toBuilder();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(PRIORITY_PREFIX)) {
                b.priority(key.substring(PRIORITY_PREFIX.length()), r.i(key));
            } else if (key.startsWith(MESSAGE_PREFIX)) {
                b.message(key.substring(MESSAGE_PREFIX.length()), props.getProperty(key).trim());
            }
        }
        r.throwIfProblems("Invalid guidance settings in " + origin);
        return b.build();
    }

    private boolean has(String key) {
        return props.getProperty(key) != null;
    }

    /** Collects every missing/invalid key before failing, so one error names them all. */
    private final class KeyReader {
        private final boolean required;
        private final List<String> problems = new ArrayList<>();

        KeyReader(boolean required) { this.required = required; }

        private String raw(String key) {
            String v = props.getProperty(key);
            if (v == null || v.trim().isEmpty()) {
                if (required) problems.add("missing key " + key);
                return null;
            }
            return v.trim();
        }

        float f(String key) {
            String v = raw(key);
            if (v == null) return 0f;
            try {
                float parsed = Float.parseFloat(v);
                if (Float.isNaN(parsed) || Float.isInfinite(parsed)) {
                    problems.add("invalid value for " + key + ": '" + v + "'");
                }
                return parsed;
            } catch (NumberFormatException e) {
                problems.add("invalid value for " + key + ": '" + v + "'");
                return 0f;
            }
        }

        int i(String key) {
            String v = raw(key);
            if (v == null) return 0;
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                problems.add("invalid value for " + key + ": '" + v + "'");
                return 0;
            }
        }

        long l(String key) {
            String v = raw(key);
            if (v == null) return 0L;
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException e) {
                problems.add("invalid value for " + key + ": '" + v + "'");
                return 0L;
            }
        }

        boolean bool(String key) {
            String v = raw(key);
            if (v == null) return false;
            if (!"true".equalsIgnoreCase(v) && !"false".equalsIgnoreCase(v)) {
                problems.add("invalid value for " + key + ": '" + v + "'");
                return false;
            }
            return Boolean.parseBoolean(v);
        }

        void throwIfProblems(String message) {
            if (!problems.isEmpty()) {
                throw new ValidatorConfigException(message, problems);
            }
        }
    }
}
