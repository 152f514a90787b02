package io.github.hydrate.persistence.store;

import io.github.hydrate.persistence.document.ReminderDocument;
import io.github.hydrate.persistence.document.UserDocument;
import io.github.hydrate.protocol.api.PushSubscription;
import io.github.hydrate.protocol.api.SubscriptionSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReminderStoreTest {

    private static final ReminderSpec EIGHT_AM = new ReminderSpec("08:00", 0, 0, null);

    @TempDir
    Path dir;

    private Path dbPath;
    private ReminderStore store;

    @BeforeEach
    void setUp() {
        dbPath = dir.resolve("db.json");
        store = new ReminderStore(new JsonFileStore(dbPath));
    }

    @Test
    void upsertSameEndpointTwiceKeepsOneUserWithStableId() {
        UserDocument first = store.upsert(sub("https://push/1", "k1"));
        UserDocument second = store.upsert(sub("https://push/1", "k2"));

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(first.getId()).matches("[0-9a-f]{16}");
        assertThat(store.listSummary()).hasSize(1);
        assertThat(store.findByEndpoint("https://push/1").orElseThrow().getSubscription().keys().p256dh())
                .isEqualTo("k2");
    }

    @Test
    void resubscribeKeepsExistingReminders() {
        store.addReminder(sub("https://push/1", "k1"), EIGHT_AM);

        store.upsert(sub("https://push/1", "k2"));

        assertThat(store.findByEndpoint("https://push/1").orElseThrow().getReminders()).hasSize(1);
    }

    @Test
    void addReminderCreatesUserAndPersists() throws Exception {
        ReminderDocument reminder = last(store.addReminder(sub("https://push/1", "k"),
                new ReminderSpec("09:00", -120, 30, "17:00")));

        assertThat(reminder.getId()).matches("[0-9a-f]{12}");
        assertThat(reminder.getLastSentISO()).isNull();
        assertThat(Files.readString(dbPath)).contains(reminder.getId());

        ReminderStore reloaded = new ReminderStore(new JsonFileStore(dbPath));
        ReminderDocument read = reloaded.findByEndpoint("https://push/1").orElseThrow().getReminders().get(0);
        assertThat(read.getTime()).isEqualTo("09:00");
        assertThat(read.getTimezoneOffsetMinutes()).isEqualTo(-120);
        assertThat(read.getRepeatEveryMinutes()).isEqualTo(30);
        assertThat(read.getRepeatUntil()).isEqualTo("17:00");
    }

    @Test
    void deleteUnknownReminderReturnsFalseAndLeavesStoreUnchanged() throws Exception {
        store.addReminder(sub("https://push/1", "k"), EIGHT_AM);
        String before = Files.readString(dbPath);

        boolean deleted = store.deleteReminder("doesnotexist");

        assertThat(deleted).isFalse();
        assertThat(Files.readString(dbPath)).isEqualTo(before);
        assertThat(store.listSummary()).containsExactly(
                new SubscriptionSummary.UserSummary(store.snapshot().get(0).getId(), 1));
    }

    @Test
    void deleteReminderRemovesOnlyThatReminder() {
        ReminderDocument a = last(store.addReminder(sub("https://push/1", "k"), EIGHT_AM));
        ReminderDocument b = last(store.addReminder(sub("https://push/1", "k"), new ReminderSpec("12:00", 0, 0, null)));

        assertThat(store.deleteReminder(a.getId())).isTrue();

        List<ReminderDocument> left = store.findByEndpoint("https://push/1").orElseThrow().getReminders();
        assertThat(left).extracting(ReminderDocument::getId).containsExactly(b.getId());
    }

    @Test
    void getRemindersOfUnknownUserIsEmpty() {
        assertThat(store.getReminders("nobody")).isEmpty();
    }

    @Test
    void removeUserDropsAllItsReminders() {
        store.addReminder(sub("https://push/1", "k"), EIGHT_AM);
        UserDocument user = store.findByEndpoint("https://push/1").orElseThrow();

        assertThat(store.removeUser("https://push/1")).isTrue();
        assertThat(store.removeUser("https://push/1")).isFalse();
        assertThat(store.getReminders(user.getId())).isEmpty();
        assertThat(store.snapshot()).isEmpty();
    }

    @Test
    void snapshotIsDetachedFromStore() {
        store.addReminder(sub("https://push/1", "k"), EIGHT_AM);

        List<UserDocument> snapshot = store.snapshot();
        snapshot.get(0).getReminders().get(0).setLastSentISO(Instant.parse("2026-01-01T00:00:00Z"));
        snapshot.get(0).getReminders().clear();

        ReminderDocument stored = store.snapshot().get(0).getReminders().get(0);
        assertThat(stored.getLastSentISO()).isNull();
    }

    @Test
    void commitAppliesSendTimesAndRemovalsInOneWrite() {
        ReminderDocument kept = last(store.addReminder(sub("https://push/1", "k"), EIGHT_AM));
        store.addReminder(sub("https://push/2", "k"), EIGHT_AM);
        Instant now = Instant.parse("2026-03-01T08:00:00Z");

        store.commit(Map.of(kept.getId(), now), Set.of("https://push/2"));

        List<UserDocument> users = store.snapshot();
        assertThat(users).extracting(UserDocument::endpoint).containsExactly("https://push/1");
        assertThat(users.get(0).getReminders().get(0).getLastSentISO()).isEqualTo(now);
    }

    @Test
    void commitNeverMovesLastSentBackwards() {
        ReminderDocument reminder = last(store.addReminder(sub("https://push/1", "k"), EIGHT_AM));
        Instant later = Instant.parse("2026-03-02T08:00:00Z");
        Instant earlier = Instant.parse("2026-03-01T08:00:00Z");

        store.commit(Map.of(reminder.getId(), later), Set.of());
        store.commit(Map.of(reminder.getId(), earlier), Set.of());

        assertThat(store.snapshot().get(0).getReminders().get(0).getLastSentISO()).isEqualTo(later);
    }

    @Test
    void commitKeepsRemindersAddedAfterSnapshot() {
        ReminderDocument old = last(store.addReminder(sub("https://push/1", "k"), EIGHT_AM));
        store.snapshot();
        ReminderDocument added = last(store.addReminder(sub("https://push/1", "k"), new ReminderSpec("10:00", 0, 0, null)));

        store.commit(Map.of(old.getId(), Instant.parse("2026-03-01T08:00:00Z")), Set.of());

        assertThat(store.snapshot().get(0).getReminders())
                .extracting(ReminderDocument::getId)
                .containsExactly(old.getId(), added.getId());
    }

    @Test
    void idCollisionsAreRetried() {
        IdGenerator ids = new IdGenerator() {
            private int calls;

            @Override
            public String userId() {
                return calls++ < 2 ? "0000000000000001" : "0000000000000002";
            }
        };
        ReminderStore local = new ReminderStore(new JsonFileStore(dir.resolve("other.json")), ids);

        UserDocument a = local.upsert(sub("https://push/a", "k"));
        UserDocument b = local.upsert(sub("https://push/b", "k"));

        assertThat(a.getId()).isEqualTo("0000000000000001");
        assertThat(b.getId()).isEqualTo("0000000000000002");
    }

    @Test
    void addReminderReturnsOwnerWithAllReminders() {
        store.addReminder(sub("https://push/1", "k"), EIGHT_AM);

        UserDocument owner = store.addReminder(sub("https://push/1", "k"), new ReminderSpec("12:00", 0, 0, null));

        assertThat(owner.endpoint()).isEqualTo("https://push/1");
        assertThat(owner.getReminders()).extracting(ReminderDocument::getTime).containsExactly("08:00", "12:00");
    }

    @Test
    void failedWriteLeavesMemoryUnchanged() throws Exception {
        ReminderDocument existing = last(store.addReminder(sub("https://push/1", "k"), EIGHT_AM));
        String onDisk = Files.readString(dbPath);
        blockWrites();

        assertThatThrownBy(() -> store.addReminder(sub("https://push/2", "k"), EIGHT_AM))
                .isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> store.addReminder(sub("https://push/1", "k"), EIGHT_AM))
                .isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> store.deleteReminder(existing.getId()))
                .isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> store.removeUser("https://push/1"))
                .isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> store.commit(Map.of(existing.getId(), Instant.parse("2026-03-01T08:00:00Z")), Set.of()))
                .isInstanceOf(PersistenceException.class);

        assertThat(store.findByEndpoint("https://push/2")).isEmpty();
        assertThat(store.snapshot()).singleElement().satisfies(user -> {
            assertThat(user.getReminders()).extracting(ReminderDocument::getId).containsExactly(existing.getId());
            assertThat(user.getReminders().get(0).getLastSentISO()).isNull();
        });
        assertThat(Files.readString(dbPath)).isEqualTo(onDisk);
    }

    @Test
    void concurrentAddsAndCommitsLoseNothing() throws Exception {
        ReminderDocument ticked = last(store.addReminder(sub("https://push/0", "k"), EIGHT_AM));
        int writers = 4;
        int perWriter = 25;
        Instant base = Instant.parse("2026-03-01T08:00:00Z");
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                String endpoint = "https://push/w" + w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        store.addReminder(sub(endpoint, "k"), EIGHT_AM);
                    }
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 1; i <= perWriter; i++) {
                    store.commit(Map.of(ticked.getId(), base.plusSeconds(60L * i)), Set.of());
                }
                return null;
            }));
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<UserDocument> users = new ReminderStore(new JsonFileStore(dbPath)).snapshot();
        assertThat(users).hasSize(writers + 1);
        assertThat(users).filteredOn(u -> !u.endpoint().equals("https://push/0"))
                .allSatisfy(u -> assertThat(u.getReminders()).hasSize(perWriter));
        assertThat(users.get(0).getReminders().get(0).getLastSentISO())
                .isEqualTo(base.plusSeconds(60L * perWriter));
        assertThat(users.stream().flatMap(u -> u.getReminders().stream()).map(ReminderDocument::getId).distinct())
                .hasSize(writers * perWriter + 1);
    }

    /** A non-empty directory where the temp file goes makes every write fail. */
    private void blockWrites() throws Exception {
        Path tmp = dir.resolve("db.json.tmp");
        Files.createDirectories(tmp);
        Files.writeString(tmp.resolve("occupied"), "x");
    }

    private static ReminderDocument last(UserDocument owner) {
        List<ReminderDocument> reminders = owner.getReminders();
        return reminders.get(reminders.size() - 1);
    }

    private PushSubscription sub(String endpoint, String p256dh) {
        return new PushSubscription(endpoint, null, new PushSubscription.Keys(p256dh, "auth"));
    }
}
