package io.github.hydrate.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.hydrate.protocol.api.PushSubscription;

import java.util.ArrayList;
import java.util.List;

/**
 * A subscriber: one push endpoint and the reminders attached to it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserDocument {

    private String id;
    private PushSubscription subscription;
    private List<ReminderDocument> reminders = new ArrayList<>();

    public UserDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public PushSubscription getSubscription() { return subscription; }
    public void setSubscription(PushSubscription subscription) { this.subscription = subscription; }

    public List<ReminderDocument> getReminders() { return reminders; }
    public void setReminders(List<ReminderDocument> reminders) {
        this.reminders = reminders != null ? reminders : new ArrayList<>();
    }

    public String endpoint() {
        return subscription != null ? subscription.endpoint() : null;
    }

    /** Deep copy; reminders are copied one by one. */
    public UserDocument copy() {
        UserDocument c = new UserDocument();
        c.id = id;
        c.subscription = subscription;
        List<ReminderDocument> copies = new ArrayList<>(reminders.size());
        for (ReminderDocument r : reminders) {
            copies.add(r.copy());
        }
        c.reminders = copies;
        return c;
    }
}
