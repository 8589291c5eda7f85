package com.photocheck.sdk.quality;

/** Outcome severity, lowest first. Guidance is ordered most severe first. */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
