package com.sqconfig.core.error;

/**
 * Thrown when the platform answers 429 Too Many Requests.
 */
public class RateLimitedException extends SqConfigException {

    public RateLimitedException(String message) {
        super(ErrorCode.API, message);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(ErrorCode.API, message, cause);
    }
}
