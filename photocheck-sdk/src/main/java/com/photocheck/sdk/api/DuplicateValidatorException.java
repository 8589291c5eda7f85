package com.photocheck.sdk.api;

/** A validator with the same name is already registered. */
public class DuplicateValidatorException extends PhotoCheckException {

    private final String validatorName;

    public DuplicateValidatorException(String validatorName) {
        super(ErrorCode.DUPLICATE_VALIDATOR,
                "Validator already registered: " + validatorName, "registry");
        this.validatorName = validatorName;
    }

    public String getValidatorName() { return validatorName; }
}
