package com.photocheck.sdk.quality;

import com.photocheck.sdk.api.DuplicateValidatorException;
import com.photocheck.sdk.logging.SafeLogger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of validators keyed by unique name. Registration order is evaluation order.
 * Not thread-safe: populate before the session loop starts.
 */
public final class ValidatorRegistry {

    private static final String TAG = "ValidatorRegistry";

    private final Map<String, Validator> validators = new LinkedHashMap<>();
    private final Map<String, Boolean>   required   = new LinkedHashMap<>();

    /**
     * Register a validator whose outcome gates the overall result.
     *
     * @throws DuplicateValidatorException when the name is taken; the registry is unchanged
     */
    public void register(Validator validator) {
        add(validator, true);
    }

    /** Register a validator reported for information only. */
    public void registerAdvisory(Validator validator) {
        add(validator, false);
    }

    private void add(Validator validator, boolean isRequired) {
        if (validator == null) {
            throw new IllegalArgumentException("validator must not be null");
        }
        String name = validator.name();
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("validator name must not be empty");
        }
        if (validators.containsKey(name)) {
            throw new DuplicateValidatorException(name);
        }
        validators.put(name, validator);
        required.put(name, isRequired);
        SafeLogger.d(TAG, "registered " + name + (isRequired ? "" : " (advisory)"));
    }

    /** @return true when a validator with that name was removed */
    public boolean unregister(String name) {
        required.remove(name);
        return validators.remove(name) != null;
    }

    /** Snapshot in registration order. */
    public List<Validator> activeValidators() {
        return Collections.unmodifiableList(new ArrayList<>(validators.values()));
    }

    public boolean isRequired(String name) {
        Boolean r = required.get(name);
        return r != null && r;
    }

    public boolean contains(String name) {
        return validators.containsKey(name);
    }

    public Validator get(String name) {
        return validators.get(name);
    }

    public int size() {
        return validators.size();
    }
}
