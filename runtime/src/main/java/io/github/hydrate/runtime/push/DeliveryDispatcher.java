package io.github.hydrate.runtime.push;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hydrate.protocol.api.NotificationPayload;
import io.github.hydrate.protocol.api.PushSubscription;
import io.github.hydrate.runtime.config.HydrateProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Sends one notification and classifies the result. No retries happen here; a transient
 * failure is simply tried again on the next scheduler tick.
 */
@Service
public class DeliveryDispatcher {

    private final PushSender sender;
    private final ObjectMapper objectMapper;
    private final Duration sendTimeout;

    public DeliveryDispatcher(PushSender sender, ObjectMapper objectMapper, HydrateProperties properties) {
        this.sender = sender;
        this.objectMapper = objectMapper;
        this.sendTimeout = properties.getPush().getSendTimeout();
    }

    public DeliveryOutcome deliver(PushSubscription subscription, NotificationPayload payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Notification payload is not serializable", e);
        }

        try {
            return classify(sender.send(subscription, body, sendTimeout));
        } catch (TimeoutException e) {
            return new DeliveryOutcome.TransientFailure("push service did not answer within " + sendTimeout.toMillis() + " ms");
        } catch (PushSendException e) {
            return new DeliveryOutcome.TransientFailure(e.getMessage());
        }
    }

    public boolean isConfigured() {
        return sender.isConfigured();
    }

    static DeliveryOutcome classify(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return new DeliveryOutcome.Delivered(statusCode);
        }
        if (statusCode == 404 || statusCode == 410) {
            return new DeliveryOutcome.PermanentFailure(statusCode);
        }
        return new DeliveryOutcome.TransientFailure("push service answered " + statusCode);
    }
}
