package com.teknolojikpanda.codereview.core;

/**
 * The remote client is missing a credential, a provider profile or a relay address.
 */
public class ReviewClientConfigurationException extends RuntimeException {

    public ReviewClientConfigurationException(String message) {
        super(message);
    }
}
