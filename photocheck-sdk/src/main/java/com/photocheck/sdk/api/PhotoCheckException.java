package com.photocheck.sdk.api;

/**
 * Standard runtime exception of the SDK. errorCode + where (optional) + cause.
 */
public class PhotoCheckException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String where;

    public PhotoCheckException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.where = null;
    }

    public PhotoCheckException(ErrorCode errorCode, String message, String where) {
        super(message);
        this.errorCode = errorCode;
        this.where = where;
    }

    public PhotoCheckException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.where = null;
    }

    public ErrorCode getErrorCode() { return errorCode; }

    /** Component or operation that raised the error, may be null. */
    public String getWhere() { return where; }
}
