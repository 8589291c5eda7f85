package com.photocheck.sdk.api;

import java.util.Collections;
import java.util.List;

/**
 * Threshold configuration is missing or invalid. Fatal at startup: no session begins.
 */
public class ValidatorConfigException extends PhotoCheckException {

    private final List<String> problems;

    public ValidatorConfigException(String message, List<String> problems) {
        super(ErrorCode.CONFIG_INVALID, message + ": " + String.join(", ", problems), "config");
        this.problems = Collections.unmodifiableList(problems);
    }

    public ValidatorConfigException(String message, Throwable cause) {
        super(ErrorCode.CONFIG_INVALID, message, cause);
        this.problems = Collections.emptyList();
    }

    /** Missing or invalid keys, one entry per key. */
    public List<String> getProblems() { return problems; }
}
