package com.sqconfig.core.error;

/**
 * Thrown when the platform edition or version does not offer a feature (portfolios, applications).
 */
public class UnsupportedFeatureException extends SqConfigException {

    public UnsupportedFeatureException(String message) {
        super(ErrorCode.UNSUPPORTED_OPERATION, message);
    }

    public UnsupportedFeatureException(String message, Throwable cause) {
        super(ErrorCode.UNSUPPORTED_OPERATION, message, cause);
    }
}
