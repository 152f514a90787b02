package io.github.hydrate.runtime.error;

public class NotFoundException extends HydrateException {

    public NotFoundException(String message) {
        super(message);
    }
}
