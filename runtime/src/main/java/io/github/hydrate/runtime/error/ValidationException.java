package io.github.hydrate.runtime.error;

public class ValidationException extends HydrateException {

    public ValidationException(String message) {
        super(message);
    }
}
