package com.scholarly.citegraph.exception;

/**
 * An upstream bibliographic service could not answer a request that has no degraded fallback,
 * such as a journal search or a shard download.
 */
public class ProviderUnavailableException extends RuntimeException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
