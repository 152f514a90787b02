package io.github.hydrate.persistence.store;

import io.github.hydrate.persistence.document.DatabaseDocument;
import io.github.hydrate.persistence.document.ReminderDocument;
import io.github.hydrate.persistence.document.UserDocument;
import io.github.hydrate.protocol.api.PushSubscription;
import io.github.hydrate.protocol.api.SubscriptionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory owner of all subscribers and their reminders, backed by a {@link JsonFileStore}.
 * <p>
 * Every read-modify-write runs under a single lock. A mutation is built on a copy of the state,
 * written in full, and only then made current. Callers only ever receive copies.
 */
public class ReminderStore {

    private static final Logger log = LoggerFactory.getLogger(ReminderStore.class);

    private final JsonFileStore fileStore;
    private final IdGenerator ids;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<UserDocument> users;

    public ReminderStore(JsonFileStore fileStore) {
        this(fileStore, new IdGenerator());
    }

    public ReminderStore(JsonFileStore fileStore, IdGenerator ids) {
        this.fileStore = fileStore;
        this.ids = ids;
        this.users = new ArrayList<>(fileStore.read().getUsers());
        log.info("Loaded {} subscribers from {}", users.size(), fileStore.getPath());
    }

    // ---- Queries ----

    public Optional<UserDocument> findByEndpoint(String endpoint) {
        return locked(() -> lookupByEndpoint(endpoint).map(UserDocument::copy));
    }

    public Optional<UserDocument> findById(String userId) {
        return locked(() -> lookupById(userId).map(UserDocument::copy));
    }

    public Optional<List<ReminderDocument>> getReminders(String userId) {
        return findById(userId).map(UserDocument::getReminders);
    }

    public List<SubscriptionSummary.UserSummary> listSummary() {
        return locked(() -> users.stream()
                .map(u -> new SubscriptionSummary.UserSummary(u.getId(), u.getReminders().size()))
                .toList());
    }

    /** Deep copy of every subscriber, in insertion order. */
    public List<UserDocument> snapshot() {
        return locked(() -> users.stream().map(UserDocument::copy).toList());
    }

    // ---- Mutations ----

    /**
     * Creates a subscriber for a new endpoint, or replaces the stored subscription of an
     * existing one while keeping its id and reminders.
     */
    public UserDocument upsert(PushSubscription subscription) {
        return mutate(next -> upsertInto(next, subscription).copy());
    }

    /**
     * Upserts the subscriber and appends a new reminder to it.
     *
     * @return the owning subscriber as stored after the write, the new reminder last
     */
    public UserDocument addReminder(PushSubscription subscription, ReminderSpec spec) {
        return mutate(next -> {
            UserDocument user = upsertInto(next, subscription);
            ReminderDocument reminder = new ReminderDocument();
            reminder.setId(newReminderId(next));
            reminder.setTime(spec.time());
            reminder.setTimezoneOffsetMinutes(spec.timezoneOffsetMinutes());
            reminder.setRepeatEveryMinutes(spec.repeatEveryMinutes());
            reminder.setRepeatUntil(spec.repeatUntil());
            user.getReminders().add(reminder);
            return user.copy();
        });
    }

    /** @return {@code false} if no subscriber owns a reminder with this id */
    public boolean deleteReminder(String reminderId) {
        return locked(() -> {
            if (!reminderIdTaken(users, reminderId)) {
                return false;
            }
            return mutate(next -> {
                next.forEach(u -> u.getReminders().removeIf(r -> reminderId.equals(r.getId())));
                return true;
            });
        });
    }

    public boolean removeUser(String endpoint) {
        return locked(() -> {
            if (lookupByEndpoint(users, endpoint).isEmpty()) {
                return false;
            }
            return mutate(next -> next.removeIf(u -> endpoint.equals(u.endpoint())));
        });
    }

    /**
     * Applies the outcome of a delivery pass in one write. Send times are applied only to
     * reminders that still exist and never move a reminder's last-sent time backwards.
     *
     * @param sentAt        reminder id to instant of confirmed delivery
     * @param goneEndpoints endpoints whose subscribers must be dropped
     */
    public void commit(Map<String, Instant> sentAt, Set<String> goneEndpoints) {
        mutate(next -> {
            Iterator<UserDocument> it = next.iterator();
            while (it.hasNext()) {
                UserDocument user = it.next();
                if (goneEndpoints.contains(user.endpoint())) {
                    it.remove();
                    log.info("Removed subscriber {} ({})", user.getId(), user.endpoint());
                    continue;
                }
                for (ReminderDocument reminder : user.getReminders()) {
                    Instant sent = sentAt.get(reminder.getId());
                    if (sent != null && (reminder.getLastSentISO() == null || sent.isAfter(reminder.getLastSentISO()))) {
                        reminder.setLastSentISO(sent);
                    }
                }
            }
            return null;
        });
    }

    // ---- internals, lock held ----

    /**
     * Applies {@code change} to a copy of the current state and makes the copy current only
     * once it has been written. A failed write leaves memory as it was on disk.
     */
    private <T> T mutate(Function<List<UserDocument>, T> change) {
        return locked(() -> {
            List<UserDocument> next = new ArrayList<>(users.size());
            for (UserDocument user : users) {
                next.add(user.copy());
            }
            T result = change.apply(next);
            fileStore.write(new DatabaseDocument(next));
            users.clear();
            users.addAll(next);
            return result;
        });
    }

    private UserDocument upsertInto(List<UserDocument> target, PushSubscription subscription) {
        Optional<UserDocument> existing = lookupByEndpoint(target, subscription.endpoint());
        if (existing.isPresent()) {
            existing.get().setSubscription(subscription);
            return existing.get();
        }
        UserDocument user = new UserDocument();
        user.setId(newUserId(target));
        user.setSubscription(subscription);
        target.add(user);
        log.info("New subscriber {}", user.getId());
        return user;
    }

    private Optional<UserDocument> lookupByEndpoint(String endpoint) {
        return lookupByEndpoint(users, endpoint);
    }

    private static Optional<UserDocument> lookupByEndpoint(List<UserDocument> source, String endpoint) {
        return source.stream().filter(u -> endpoint != null && endpoint.equals(u.endpoint())).findFirst();
    }

    private Optional<UserDocument> lookupById(String userId) {
        return users.stream().filter(u -> userId.equals(u.getId())).findFirst();
    }

    private String newUserId(List<UserDocument> target) {
        String id;
        do {
            id = ids.userId();
        } while (idTaken(target, id));
        return id;
    }

    private static boolean idTaken(List<UserDocument> source, String id) {
        return source.stream().anyMatch(u -> id.equals(u.getId()));
    }

    private String newReminderId(List<UserDocument> target) {
        String id;
        do {
            id = ids.reminderId();
        } while (reminderIdTaken(target, id));
        return id;
    }

    private static boolean reminderIdTaken(List<UserDocument> source, String id) {
        return source.stream().flatMap(u -> u.getReminders().stream()).anyMatch(r -> id.equals(r.getId()));
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
