package com.photocheck.sdk.api;

import com.photocheck.sdk.config.CaptureConfig;
import com.photocheck.sdk.config.ConfigurationSource;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.PerceptionAdapter;
import com.photocheck.sdk.feedback.FeedbackTranslator;
import com.photocheck.sdk.feedback.GuidanceCatalog;
import com.photocheck.sdk.logging.SafeLogger;
import com.photocheck.sdk.quality.ValidationOrchestrator;
import com.photocheck.sdk.quality.ValidatorFactory;
import com.photocheck.sdk.quality.ValidatorRegistry;
import com.photocheck.sdk.session.BoothSession;
import com.photocheck.sdk.storage.CapturePersister;
import com.photocheck.sdk.storage.StorageCollaborator;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * PhotoCheck SDK public facade.
 *
 * <pre>
 *   PhotoCheckSdk sdk = PhotoCheckSdk.create(
 *           PropertiesConfigurationSource.fromDefaults(), perceptionAdapter, storage);
 *   BoothSession session = sdk.openSession();
 *   // per camera frame:
 *   FrameTick tick = session.onFrame(frame);
 * </pre>
 *
 * Configuration is read once here and stays fixed for every session opened from this
 * instance. Add custom validators through {@link #registry()} before opening sessions.
 */
public final class PhotoCheckSdk {

    private static final String TAG = "PhotoCheckSdk";

    private final ValidatorConfig        validatorConfig;
    private final CaptureConfig          captureConfig;
    private final GuidanceCatalog        catalog;
    private final ValidatorRegistry      registry;
    private final ValidationOrchestrator orchestrator;
    private final FeedbackTranslator     translator;
    private final StorageCollaborator    storage;
    private final AtomicInteger          sessionCounter = new AtomicInteger();

    private PhotoCheckSdk(ValidatorConfig validatorConfig, CaptureConfig captureConfig,
                          GuidanceCatalog catalog, PerceptionAdapter perception,
                          StorageCollaborator storage) {
        this.validatorConfig = validatorConfig;
        this.captureConfig   = captureConfig;
        this.catalog         = catalog;
        this.storage         = storage;
        this.registry        = ValidatorFactory.createRegistry(validatorConfig);
        this.orchestrator    = new ValidationOrchestrator(registry, perception, validatorConfig);
        this.translator      = new FeedbackTranslator(catalog);
    }

    /**
     * @throws ValidatorConfigException when configuration is missing or invalid; no session can start
     */
    public static PhotoCheckSdk create(ConfigurationSource source,
                                       PerceptionAdapter perception,
                                       StorageCollaborator storage) {
        if (source == null || perception == null || storage == null) {
            throw new IllegalArgumentException("configuration, perception and storage are required");
        }
        ValidatorConfig thresholds = source.loadThresholds();
        CaptureConfig capture      = source.loadCaptureConfig();
        GuidanceCatalog catalog    = source.loadGuidanceCatalog();
        PhotoCheckSdk sdk = new PhotoCheckSdk(thresholds, capture, catalog, perception, storage);
        SafeLogger.i(TAG, "SDK ready (layout=" + thresholds.landmarkLayout.modelVersion
                + ", validators=" + sdk.registry.size() + ")");
        return sdk;
    }

    /** Opens a new capture session. A booth runs one session at a time. */
    public BoothSession openSession() {
        String id = "booth-" + sessionCounter.incrementAndGet();
        CapturePersister persister = new CapturePersister(storage,
                captureConfig.storageRetries, captureConfig.storageRetryBackoffMs);
        return new BoothSession(id, orchestrator, translator, persister, captureConfig);
    }

    public ValidatorRegistry registry()           { return registry; }
    public ValidationOrchestrator orchestrator()  { return orchestrator; }
    public FeedbackTranslator translator()        { return translator; }
    public ValidatorConfig validatorConfig()      { return validatorConfig; }
    public CaptureConfig captureConfig()          { return captureConfig; }
    public GuidanceCatalog guidanceCatalog()      { return catalog; }
}
