package com.photocheck.sdk.config;

import com.photocheck.sdk.api.ErrorCode;
import com.photocheck.sdk.api.ValidatorConfigException;
import com.photocheck.sdk.feedback.GuidanceCatalog;
import com.photocheck.sdk.quality.OutcomeCodes;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.Assert.*;

public class PropertiesConfigurationSourceTest {

    @Rule public TemporaryFolder tmp = new TemporaryFolder();

    private static Properties defaults() throws IOException {
        Properties p = new Properties();
        try (InputStream in = PropertiesConfigurationSource.class.getClassLoader()
                .getResourceAsStream(PropertiesConfigurationSource.DEFAULT_RESOURCE)) {
            p.load(in);
        }
        return p;
    }

    @Test
    public void shippedDefaults_matchBuilderDefaults() {
        PropertiesConfigurationSource src = PropertiesConfigurationSource.fromDefaults();

        ValidatorConfig loaded = src.loadThresholds();
        ValidatorConfig built  = ValidatorConfig.defaults();
        assertEquals(built.brightnessMeanMin, loaded.brightnessMeanMin, 0f);
        assertEquals(built.sharpnessMin, loaded.sharpnessMin, 0f);
        assertEquals(built.faceCenterTolerance, loaded.faceCenterTolerance, 0f);
        assertEquals(built.reflectionLumaMin, loaded.reflectionLumaMin);
        assertEquals(built.headwearDarkMax, loaded.headwearDarkMax, 0f);
        assertTrue(loaded.backgroundEnabled);

        CaptureConfig capture = src.loadCaptureConfig();
        assertEquals(5, capture.stableFramesRequired);
        assertEquals(1_500L, capture.stabilityWindowMs);
        assertEquals(30_000L, capture.sessionTimeoutMs);
    }

    @Test
    public void missingKeys_areAllReported() throws IOException {
        Properties p = defaults();
        p.remove("sharpness.min");
        p.remove("shadow.maxAsymmetry");

        try {
            new PropertiesConfigurationSource(p, "test").loadThresholds();
            fail("missing keys accepted");
        } catch (ValidatorConfigException e) {
            assertEquals(ErrorCode.CONFIG_INVALID, e.getErrorCode());
            assertTrue(e.getProblems().contains("missing key sharpness.min"));
            assertTrue(e.getProblems().contains("missing key shadow.maxAsymmetry"));
            assertEquals(2, e.getProblems().size());
        }
    }

    @Test
    public void unparsableValue_isReported() throws IOException {
        Properties p = defaults();
        p.setProperty("brightness.mean.min", "dark");
        p.setProperty("background.enabled", "sometimes");

        try {
            new PropertiesConfigurationSource(p, "test").loadThresholds();
            fail("bad values accepted");
        } catch (ValidatorConfigException e) {
            assertTrue(e.getProblems().contains("invalid value for brightness.mean.min: 'dark'"));
            assertTrue(e.getProblems().contains("invalid value for background.enabled: 'sometimes'"));
        }
    }

    @Test
    public void inconsistentBand_rejectedByBuilder() throws IOException {
        Properties p = defaults();
        p.setProperty("brightness.mean.min", "210");

        try {
            new PropertiesConfigurationSource(p, "test").loadThresholds();
            fail("min above max accepted");
        } catch (ValidatorConfigException e) {
            assertTrue(e.getProblems().contains("brightness.mean min greater than max"));
        }
    }

    @Test
    public void captureKeys_areOptional() {
        Properties p = new Properties();
        p.setProperty("capture.stableFrames", "3");
        p.setProperty("storage.retries", "0");

        CaptureConfig c = new PropertiesConfigurationSource(p, "test").loadCaptureConfig();

        assertEquals(3, c.stableFramesRequired);
        assertEquals(0, c.storageRetries);
        assertEquals(1_500L, c.stabilityWindowMs);
    }

    @Test(expected = ValidatorConfigException.class)
    public void invalidCaptureValue_fails() {
        Properties p = new Properties();
        p.setProperty("capture.frameStride", "0");
        new PropertiesConfigurationSource(p, "test").loadCaptureConfig();
    }

    @Test
    public void guidanceOverrides_applyOnTopOfDefaults() {
        Properties p = new Properties();
        p.setProperty("guidance.priority.BLURRY", "1");
        p.setProperty("guidance.message.TOO_DARK", " More light please. ");

        GuidanceCatalog c = new PropertiesConfigurationSource(p, "test").loadGuidanceCatalog();

        assertEquals(1, c.priorityFor(OutcomeCodes.BLURRY));
        assertEquals("More light please.", c.messageFor(OutcomeCodes.TOO_DARK));
        assertEquals(20, c.priorityFor(OutcomeCodes.TOO_DARK));
    }

    @Test
    public void missingClasspathResource_failsStartup() {
        try {
            PropertiesConfigurationSource.fromClasspath("no-such-booth.properties");
            fail("missing resource accepted");
        } catch (ValidatorConfigException e) {
            assertEquals("classpath:no-such-booth.properties", e.getProblems().get(0));
        }
    }

    @Test
    public void fromPath_readsFile() throws IOException {
        Path file = tmp.newFile("booth.properties").toPath();
        StringBuilder sb = new StringBuilder();
        Properties p = defaults();
        p.setProperty("sharpness.min", "120");
        for (String key : p.stringPropertyNames()) {
            sb.append(key).append('=').append(p.getProperty(key)).append('\n');
        }
        Files.write(file, sb.toString().getBytes(StandardCharsets.UTF_8));

        ValidatorConfig c = PropertiesConfigurationSource.fromPath(file).loadThresholds();

        assertEquals(120f, c.sharpnessMin, 0f);
    }

    @Test(expected = ValidatorConfigException.class)
    public void fromPath_missingFile() {
        PropertiesConfigurationSource.fromPath(tmp.getRoot().toPath().resolve("absent.properties"));
    }
}
