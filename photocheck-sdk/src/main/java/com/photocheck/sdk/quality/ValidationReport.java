package com.photocheck.sdk.quality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregated outcomes of every active validator on one frame, in registry order.
 * {@code overallPassed} is true iff there is at least one required (non-advisory) outcome
 * and every required outcome passed.
 */
public final class ValidationReport {

    /** Frame timestamp (ms) the report was computed for. */
    public final long    timestamp;
    public final boolean faceDetected;
    public final boolean overallPassed;
    /** Mean score over all outcomes, advisory included; 0 when there are none. */
    public final double  overallScore;
    /** Validator name → outcome, registry order. */
    public final Map<String, ValidationOutcome> outcomes;
    /** Names of validators whose outcome does not gate {@link #overallPassed}. */
    public final Set<String> advisory;

    public ValidationReport(long timestamp, boolean faceDetected,
                            Map<String, ValidationOutcome> outcomes, Set<String> advisory) {
        this.timestamp    = timestamp;
        this.faceDetected = faceDetected;
        this.outcomes     = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        this.advisory     = advisory != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(advisory))
                : Collections.<String>emptySet();
        int required = 0;
        boolean all = true;
        double scoreSum = 0;
        for (ValidationOutcome o : this.outcomes.values()) {
            scoreSum += o.score;
            if (this.advisory.contains(o.validatorName)) continue;
            required++;
            if (!o.passed) all = false;
        }
        this.overallPassed = required > 0 && all;
        this.overallScore  = this.outcomes.isEmpty() ? 0d : scoreSum / this.outcomes.size();
    }

    public int passedCount() {
        int n = 0;
        for (ValidationOutcome o : outcomes.values()) {
            if (o.passed) n++;
        }
        return n;
    }

    public int failedCount() {
        return outcomes.size() - passedCount();
    }

    /** Outcome for the validator, null when it was not registered. */
    public ValidationOutcome outcome(String validatorName) {
        return outcomes.get(validatorName);
    }

    public boolean isAdvisory(String validatorName) {
        return advisory.contains(validatorName);
    }

    /** Failing required outcomes, registry order. */
    public List<ValidationOutcome> failedRequired() {
        List<ValidationOutcome> failed = new ArrayList<>();
        for (ValidationOutcome o : outcomes.values()) {
            if (!o.passed && !advisory.contains(o.validatorName)) failed.add(o);
        }
        return failed;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationReport)) return false;
        ValidationReport r = (ValidationReport) o;
        return timestamp == r.timestamp
                && faceDetected == r.faceDetected
                && outcomes.equals(r.outcomes)
                && advisory.equals(r.advisory);
    }

    @Override public int hashCode() {
        int h = Long.hashCode(timestamp);
        h = 31 * h + outcomes.hashCode();
        return 31 * h + advisory.hashCode();
    }

    @Override public String toString() {
        return "ValidationReport{ts=" + timestamp + ", face=" + faceDetected
                + ", passed=" + overallPassed + ", outcomes=" + outcomes.values() + "}";
    }
}
