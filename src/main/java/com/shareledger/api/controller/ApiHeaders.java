package com.shareledger.api.controller;

/**
 * Request headers understood by the REST API.
 */
public final class ApiHeaders {

    /**
     * Address of the principal submitting the call. Signature verification happens upstream.
     */
    public static final String CALLER = "X-Caller-Address";

    private ApiHeaders() {
    }
}
