package com.sqconfig.core.client;

/**
 * Raw answer of a successful web API call.
 */
public record ApiResponse(int status, String body) {

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }
}
