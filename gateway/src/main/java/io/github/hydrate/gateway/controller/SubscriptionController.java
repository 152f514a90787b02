package io.github.hydrate.gateway.controller;

import io.github.hydrate.persistence.document.UserDocument;
import io.github.hydrate.protocol.api.PushSubscription;
import io.github.hydrate.protocol.api.SubscribeResponse;
import io.github.hydrate.protocol.api.SubscriptionSummary;
import io.github.hydrate.runtime.config.HydrateProperties;
import io.github.hydrate.runtime.error.ConfigurationException;
import io.github.hydrate.runtime.reminder.ReminderService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
public class SubscriptionController {

    private final ReminderService reminderService;
    private final HydrateProperties properties;

    public SubscriptionController(ReminderService reminderService, HydrateProperties properties) {
        this.reminderService = reminderService;
        this.properties = properties;
    }

    @GetMapping(value = "/vapidPublicKey", produces = MediaType.TEXT_PLAIN_VALUE)
    public String vapidPublicKey() {
        String key = properties.getVapid().getPublicKey();
        if (key == null || key.isBlank()) {
            throw new ConfigurationException("VAPID key not configured");
        }
        return key;
    }

    @PostMapping("/subscribe")
    public SubscribeResponse subscribe(@RequestBody(required = false) PushSubscription subscription) {
        UserDocument user = reminderService.subscribe(subscription);
        return new SubscribeResponse(true, user.getId());
    }

    @GetMapping("/subs")
    public SubscriptionSummary subs() {
        return reminderService.summary();
    }
}
