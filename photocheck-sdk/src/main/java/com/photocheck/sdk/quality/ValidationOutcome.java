package com.photocheck.sdk.quality;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one validator on one frame. Immutable.
 * <p>
 * {@code score} is a normalized margin in [0,1], not a raw measurement; the raw
 * measurements go into {@code details}.
 */
public final class ValidationOutcome {

    public final String   validatorName;
    public final boolean  passed;
    public final double   score;
    public final String   code;
    public final Severity severity;
    public final Map<String, Object> details;

    private ValidationOutcome(String validatorName, boolean passed, double score,
                              String code, Severity severity, Map<String, Object> details) {
        this.validatorName = Objects.requireNonNull(validatorName, "validatorName");
        this.passed        = passed;
        this.score         = Scores.clamp(score);
        this.code          = Objects.requireNonNull(code, "code");
        this.severity      = Objects.requireNonNull(severity, "severity");
        this.details       = details != null && !details.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.<String, Object>emptyMap();
    }

    public static ValidationOutcome pass(String name, double score, Map<String, Object> details) {
        return new ValidationOutcome(name, true, score, OutcomeCodes.OK, Severity.INFO, details);
    }

    public static ValidationOutcome fail(String name, String code, double score,
                                         Severity severity, Map<String, Object> details) {
        if (OutcomeCodes.OK.equals(code)) {
            throw new IllegalArgumentException("failed outcome cannot carry OK");
        }
        return new ValidationOutcome(name, false, score, code, severity, details);
    }

    /** Landmark-dependent validator on a frame without a face. */
    public static ValidationOutcome faceNotDetected(String name) {
        return new ValidationOutcome(name, false, 0d, OutcomeCodes.FACE_NOT_DETECTED,
                Severity.CRITICAL, null);
    }

    public static ValidationOutcome internalError(String name, Throwable t) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exception", t.getClass().getSimpleName());
        if (t.getMessage() != null) details.put("message", t.getMessage());
        return new ValidationOutcome(name, false, 0d, OutcomeCodes.VALIDATOR_INTERNAL_ERROR,
                Severity.ERROR, details);
    }

    /** Copy with another severity, used when an advisory failure is downgraded. */
    public ValidationOutcome withSeverity(Severity s) {
        if (s == severity) return this;
        return new ValidationOutcome(validatorName, passed, score, code, s, details);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationOutcome)) return false;
        ValidationOutcome v = (ValidationOutcome) o;
        return passed == v.passed
                && Double.compare(score, v.score) == 0
                && validatorName.equals(v.validatorName)
                && code.equals(v.code)
                && severity == v.severity
                && details.equals(v.details);
    }

    @Override public int hashCode() {
        return Objects.hash(validatorName, passed, score, code, severity, details);
    }

    @Override public String toString() {
        return validatorName + "{" + (passed ? "pass" : "fail") + ", " + code
                + ", score=" + String.format("%.3f", score) + ", " + severity + "}";
    }
}
