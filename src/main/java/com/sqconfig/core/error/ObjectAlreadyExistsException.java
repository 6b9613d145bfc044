package com.sqconfig.core.error;

/**
 * Thrown when creating an object whose key or name is already taken.
 */
public class ObjectAlreadyExistsException extends SqConfigException {

    public ObjectAlreadyExistsException(String message) {
        super(ErrorCode.OBJECT_ALREADY_EXISTS, message);
    }

    public ObjectAlreadyExistsException(String message, Throwable cause) {
        super(ErrorCode.OBJECT_ALREADY_EXISTS, message, cause);
    }
}
