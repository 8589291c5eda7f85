package com.photocheck.sdk.logging;

import com.photocheck.sdk.api.DuplicateValidatorException;
import com.photocheck.sdk.api.ErrorCode;
import com.photocheck.sdk.api.ValidatorConfigException;
import com.photocheck.sdk.detection.PerceptionUnavailableException;
import com.photocheck.sdk.storage.StorageException;

import org.junit.Test;

import java.util.Collections;

import static org.junit.Assert.*;

public class ErrorMapperTest {

    @Test
    public void sdkExceptions_keepTheirCode() {
        assertEquals(ErrorCode.CONFIG_INVALID, ErrorMapper.map(
                new ValidatorConfigException("bad", Collections.singletonList("missing key x"))));
        assertEquals(ErrorCode.DUPLICATE_VALIDATOR, ErrorMapper.map(new DuplicateValidatorException("Brightness")));
    }

    @Test
    public void collaboratorFailures() {
        assertEquals(ErrorCode.PERCEPTION_UNAVAILABLE,
                ErrorMapper.map(new PerceptionUnavailableException("no model")));
        assertEquals(ErrorCode.STORAGE_FAIL, ErrorMapper.map(new StorageException("disk full")));
    }

    @Test
    public void wrappedCause_isUnwrapped() {
        RuntimeException wrapped = new RuntimeException("outer", new StorageException("inner"));
        assertEquals(ErrorCode.STORAGE_FAIL, ErrorMapper.map(wrapped, "session"));
    }

    @Test
    public void plainException_mappedByContext() {
        assertEquals(ErrorCode.VALIDATOR_FAIL, ErrorMapper.map(new ArithmeticException(), "validator"));
        assertEquals(ErrorCode.UNKNOWN, ErrorMapper.map(new ArithmeticException(), "listener"));
        assertEquals(ErrorCode.UNKNOWN, ErrorMapper.map(new ArithmeticException()));
    }
}
