package io.github.hydrate.runtime.error;

/** Raised when an operation needs VAPID keys that were never configured. */
public class ConfigurationException extends HydrateException {

    public ConfigurationException(String message) {
        super(message);
    }
}
