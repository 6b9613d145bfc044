package com.sqconfig.core.error;

/**
 * Base class of every failure raised while talking to the platform or
 * processing its configuration. Carries the {@link ErrorCode} used as exit status.
 */
public class SqConfigException extends RuntimeException {

    private final ErrorCode errorCode;

    public SqConfigException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SqConfigException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
