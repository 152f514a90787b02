package io.github.hydrate.runtime.error;

/**
 * Base of the errors a request can end with; the gateway maps each subtype to an HTTP status.
 */
public abstract class HydrateException extends RuntimeException {

    protected HydrateException(String message) {
        super(message);
    }
}
