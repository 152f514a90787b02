package io.github.hydrate.runtime.reminder;

import io.github.hydrate.persistence.document.ReminderDocument;
import io.github.hydrate.persistence.document.UserDocument;
import io.github.hydrate.persistence.store.ReminderSpec;
import io.github.hydrate.persistence.store.ReminderStore;
import io.github.hydrate.protocol.api.AddReminderRequest;
import io.github.hydrate.protocol.api.PushSubscription;
import io.github.hydrate.protocol.api.SubscriptionSummary;
import io.github.hydrate.runtime.error.NotFoundException;
import io.github.hydrate.runtime.error.ValidationException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ReminderService {

    private final ReminderStore store;

    public ReminderService(ReminderStore store) {
        this.store = store;
    }

    public UserDocument subscribe(PushSubscription subscription) {
        if (subscription == null || !subscription.hasEndpoint()) {
            throw new ValidationException("Invalid subscription");
        }
        return store.upsert(subscription);
    }

    /** @return all reminders of the subscriber, the new one last */
    public List<ReminderDocument> addReminder(AddReminderRequest req) {
        if (req == null || req.subscription() == null || !req.subscription().hasEndpoint()) {
            throw new ValidationException("subscription required");
        }
        if (req.time() == null || req.time().isBlank()) {
            throw new ValidationException("time (HH:MM) required");
        }
        ReminderTime time = ReminderTime.parse(req.time())
                .orElseThrow(() -> new ValidationException("time must be HH:MM"));

        int repeatEvery = req.repeatEveryMinutes() != null ? req.repeatEveryMinutes() : 0;
        if (repeatEvery < 0) {
            throw new ValidationException("repeatEveryMinutes must not be negative");
        }

        String repeatUntil = null;
        if (req.repeatUntil() != null && !req.repeatUntil().isBlank()) {
            repeatUntil = ReminderTime.parse(req.repeatUntil())
                    .orElseThrow(() -> new ValidationException("repeatUntil must be HH:MM"))
                    .toString();
        }

        int offset = req.timezoneOffsetMinutes() != null ? req.timezoneOffsetMinutes() : 0;
        return store.addReminder(req.subscription(), new ReminderSpec(time.toString(), offset, repeatEvery, repeatUntil))
                .getReminders();
    }

    public void deleteReminder(String reminderId) {
        if (reminderId == null || reminderId.isBlank()) {
            throw new ValidationException("id required");
        }
        if (!store.deleteReminder(reminderId)) {
            throw new NotFoundException("not found");
        }
    }

    public List<ReminderDocument> getReminders(String userId) {
        return store.getReminders(userId)
                .orElseThrow(() -> new NotFoundException("user not found"));
    }

    public SubscriptionSummary summary() {
        List<SubscriptionSummary.UserSummary> users = store.listSummary();
        return new SubscriptionSummary(users.size(), users);
    }
}
