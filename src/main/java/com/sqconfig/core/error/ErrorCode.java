package com.sqconfig.core.error;

/**
 * Error categories surfaced by sqconfig, each mapped to the process exit code
 * returned by the CLI.
 */
public enum ErrorCode {

    OK(0),
    AUTHENTICATION(1),
    AUTHORIZATION(2),
    API(3),
    TOKEN_MISSING(4),
    NO_SUCH_KEY(5),
    WRONG_SEARCH_CRITERIA(6),
    UNSUPPORTED_OPERATION(7),
    ARGS_ERROR(10),
    REQUEST_TIMEOUT(12),
    OBJECT_ALREADY_EXISTS(13),
    OS_ERROR(14),
    TRANSPORT(15),
    UNEXPECTED(16);

    private final int exitCode;

    ErrorCode(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
