package io.github.hydrate.runtime.push;

import io.github.hydrate.persistence.document.UserDocument;
import io.github.hydrate.persistence.store.ReminderStore;
import io.github.hydrate.protocol.api.DeliveryResultDto;
import io.github.hydrate.protocol.api.NotificationPayload;
import io.github.hydrate.runtime.config.HydrateProperties;
import io.github.hydrate.runtime.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Manual "send to everyone", independent of reminder schedules.
 */
@Service
public class BroadcastService {

    private static final Logger log = LoggerFactory.getLogger(BroadcastService.class);

    private final ReminderStore store;
    private final DeliveryDispatcher dispatcher;
    private final HydrateProperties properties;

    public BroadcastService(ReminderStore store, DeliveryDispatcher dispatcher, HydrateProperties properties) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    /**
     * Sends {@code payload}, or the default hydration message when it is {@code null}, to every
     * subscriber and drops the ones whose endpoint is gone.
     *
     * @throws ConfigurationException if VAPID keys are not configured
     */
    public List<DeliveryResultDto> broadcast(NotificationPayload payload) {
        if (!dispatcher.isConfigured()) {
            throw new ConfigurationException("VAPID keys not set");
        }
        NotificationPayload effective = payload != null ? payload : NotificationPayloads.broadcast(properties.getFrontendUrl());

        List<DeliveryResultDto> results = new ArrayList<>();
        Set<String> gone = new HashSet<>();
        for (UserDocument user : store.snapshot()) {
            String endpoint = user.endpoint();
            try {
                DeliveryOutcome outcome = dispatcher.deliver(user.getSubscription(), effective);
                if (outcome instanceof DeliveryOutcome.Delivered) {
                    results.add(DeliveryResultDto.delivered(endpoint));
                } else if (outcome instanceof DeliveryOutcome.PermanentFailure permanent) {
                    gone.add(endpoint);
                    results.add(DeliveryResultDto.failed(endpoint, String.valueOf(permanent.statusCode())));
                } else if (outcome instanceof DeliveryOutcome.TransientFailure failure) {
                    results.add(DeliveryResultDto.failed(endpoint, failure.detail()));
                }
            } catch (Exception e) {
                log.error("Broadcast to {} failed", endpoint, e);
                results.add(DeliveryResultDto.failed(endpoint, e.getMessage()));
            }
        }

        if (!gone.isEmpty()) {
            store.commit(Map.of(), gone);
        }
        log.info("Broadcast sent to {} subscribers, {} removed", results.size(), gone.size());
        return results;
    }
}
