package io.github.hydrate.gateway.exception;

import java.io.IOException;

/** Thrown while reading a request body that grows past the configured limit. */
public class RequestBodyTooLargeException extends IOException {

    public RequestBodyTooLargeException(long limit) {
        super("request body exceeds " + limit + " bytes");
    }
}
