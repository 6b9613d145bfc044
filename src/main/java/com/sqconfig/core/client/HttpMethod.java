package com.sqconfig.core.client;

public enum HttpMethod {
    GET,
    POST
}
