package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.util.LogSupport;

import java.net.URI;

/**
 * A provider or relay answered with a non-success status.
 */
public class ProviderHttpException extends RuntimeException {

    static final int EXCERPT_LENGTH = 200;

    private final int statusCode;
    private final URI endpoint;

    public ProviderHttpException(URI endpoint, int statusCode, String body) {
        super("HTTP " + statusCode + " from " + endpoint + ": " + LogSupport.abbreviate(body, EXCERPT_LENGTH));
        this.statusCode = statusCode;
        this.endpoint = endpoint;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public URI getEndpoint() {
        return endpoint;
    }
}
