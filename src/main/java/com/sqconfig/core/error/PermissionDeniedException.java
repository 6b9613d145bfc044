package com.sqconfig.core.error;

/**
 * Thrown on 401 (bad or missing credentials) and 403 (insufficient permissions).
 */
public class PermissionDeniedException extends SqConfigException {

    public PermissionDeniedException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public boolean isAuthentication() {
        return errorCode() == ErrorCode.AUTHENTICATION;
    }
}
