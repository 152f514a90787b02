package io.github.hydrate.runtime.push;

public class PushSendException extends Exception {

    public PushSendException(String message) {
        super(message);
    }

    public PushSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
