package com.sqconfig.core.error;

/**
 * Thrown when the platform answers 404 for an object, or a lookup finds no match.
 */
public class ObjectNotFoundException extends SqConfigException {

    public ObjectNotFoundException(String message) {
        super(ErrorCode.NO_SUCH_KEY, message);
    }

    public ObjectNotFoundException(String message, Throwable cause) {
        super(ErrorCode.NO_SUCH_KEY, message, cause);
    }
}
