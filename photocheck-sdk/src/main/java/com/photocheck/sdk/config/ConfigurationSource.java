package com.photocheck.sdk.config;

import com.photocheck.sdk.api.ValidatorConfigException;
import com.photocheck.sdk.feedback.GuidanceCatalog;

/**
 * Where session configuration comes from. Read once when the SDK is created.
 */
public interface ConfigurationSource {

    /**
     * @throws ValidatorConfigException listing every missing or invalid threshold key
     */
    ValidatorConfig loadThresholds();

    /** Capture loop settings; keys that are absent keep their defaults. */
    CaptureConfig loadCaptureConfig();

    /** Guidance texts and priorities; absent keys keep the catalog defaults. */
    GuidanceCatalog loadGuidanceCatalog();
}
