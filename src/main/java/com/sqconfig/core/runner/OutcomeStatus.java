package com.sqconfig.core.runner;

public enum OutcomeStatus {
    SUCCESS,
    TIMEOUT,
    TRANSPORT_ERROR,
    DOMAIN_ERROR,
    UNEXPECTED_ERROR
}
