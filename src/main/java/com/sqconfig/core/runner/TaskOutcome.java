package com.sqconfig.core.runner;

import com.sqconfig.core.error.ErrorCode;

/**
 * Result of one task of a {@link ConcurrentTaskRunner} batch.
 *
 * @param item       the input item
 * @param label      item label used in logs
 * @param status     outcome classification
 * @param result     operation result, null unless {@link OutcomeStatus#SUCCESS}
 * @param errorCode  error code of a {@link OutcomeStatus#DOMAIN_ERROR}, null otherwise
 * @param message    failure description, null on success
 * @param durationMs time from submission to completion
 */
public record TaskOutcome<T, R>(
        T item,
        String label,
        OutcomeStatus status,
        R result,
        ErrorCode errorCode,
        String message,
        long durationMs
) {

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }
}
