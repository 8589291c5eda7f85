package com.photocheck.sdk.quality;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.PerceptionAdapter;
import com.photocheck.sdk.detection.PerceptionResult;
import com.photocheck.sdk.detection.PerceptionUnavailableException;
import com.photocheck.sdk.logging.CaptureErrorLogger;
import com.photocheck.sdk.logging.SafeLogger;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs perception once per frame, then every active validator in registry order.
 * Never short-circuits: a failing validator does not stop the ones after it.
 * <p>
 * A validator that throws a RuntimeException (or returns null) becomes a
 * VALIDATOR_INTERNAL_ERROR outcome and is logged as capture_error.
 * Failing advisory outcomes are capped at WARNING severity.
 */
public final class ValidationOrchestrator {

    private static final String TAG = "Orchestrator";

    private final ValidatorRegistry registry;
    private final PerceptionAdapter perception;
    private final ValidatorConfig   config;

    public ValidationOrchestrator(ValidatorRegistry registry, PerceptionAdapter perception,
                                  ValidatorConfig config) {
        this.registry   = registry;
        this.perception = perception;
        this.config     = config;
    }

    /**
     * @throws PerceptionUnavailableException when the model cannot run or the adapter crashes;
     *                                        no report is produced
     */
    public ValidationReport run(Frame frame) throws PerceptionUnavailableException {
        PerceptionResult result;
        try {
            result = perception.detect(frame);
        } catch (RuntimeException e) {
            throw new PerceptionUnavailableException("perception adapter failed: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new PerceptionUnavailableException("perception adapter returned no result");
        }
        return evaluate(frame, result);
    }

    /** Same as {@link #run(Frame)} with a perception result already at hand. */
    public ValidationReport evaluate(Frame frame, PerceptionResult result) {
        List<Validator> active = registry.activeValidators();
        Map<String, ValidationOutcome> outcomes = new LinkedHashMap<>();
        Set<String> advisory = new LinkedHashSet<>();

        for (Validator v : active) {
            String name = v.name();
            boolean required = registry.isRequired(name);
            if (!required) advisory.add(name);

            ValidationOutcome outcome = evaluateOne(v, frame, result);
            if (!required && !outcome.passed && outcome.severity.compareTo(Severity.WARNING) > 0) {
                outcome = outcome.withSeverity(Severity.WARNING);
            }
            outcomes.put(name, outcome);
        }

        ValidationReport report = new ValidationReport(frame.timestampMs, result.isFaceDetected(),
                outcomes, advisory);
        if (SafeLogger.isDebugEnabled(TAG)) {
            SafeLogger.d(TAG, "frame ts=" + frame.timestampMs + " passed=" + report.overallPassed
                    + " failed=" + report.failedRequired().size() + "/" + active.size());
        }
        return report;
    }

    private ValidationOutcome evaluateOne(Validator v, Frame frame, PerceptionResult result) {
        String name = v.name();
        try {
            ValidationOutcome outcome = v.evaluate(frame, result, config);
            if (outcome == null) {
                throw new IllegalStateException(name + " returned no outcome");
            }
            if (!name.equals(outcome.validatorName)) {
                throw new IllegalStateException(name + " returned outcome named " + outcome.validatorName);
            }
            return outcome;
        } catch (RuntimeException e) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("validator", name);
            ctx.put("frameTs", frame.timestampMs);
            CaptureErrorLogger.log(e, "validator", ctx);
            return ValidationOutcome.internalError(name, e);
        }
    }
}
