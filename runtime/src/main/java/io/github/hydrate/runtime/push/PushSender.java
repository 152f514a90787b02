package io.github.hydrate.runtime.push;

import io.github.hydrate.protocol.api.PushSubscription;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Transport to the browser vendor's push service.
 */
public interface PushSender {

    /** Whether VAPID credentials are loaded; without them every send fails. */
    boolean isConfigured();

    /**
     * Encrypts and posts {@code payload} to the subscription endpoint.
     *
     * @return the HTTP status code answered by the push service
     * @throws TimeoutException  if no answer arrived within {@code timeout}
     * @throws PushSendException if the request could not be built or sent
     */
    int send(PushSubscription subscription, String payload, Duration timeout)
            throws PushSendException, TimeoutException;
}
