package com.sqconfig.core.error;

/**
 * Network level failure: connection refused, reset, or request timeout.
 */
public class TransportException extends SqConfigException {

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT, message, cause);
    }

    public TransportException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
