package io.github.hydrate.runtime.reminder;

import io.github.hydrate.persistence.document.ReminderDocument;
import io.github.hydrate.persistence.document.UserDocument;
import io.github.hydrate.persistence.store.ReminderStore;
import io.github.hydrate.runtime.config.HydrateProperties;
import io.github.hydrate.runtime.push.DeliveryDispatcher;
import io.github.hydrate.runtime.push.DeliveryOutcome;
import io.github.hydrate.runtime.push.NotificationPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Once a minute, sends every reminder that is due and records the result in one store commit.
 */
@Component
public class ReminderScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

    private final ReminderStore store;
    private final ReminderMatcher matcher;
    private final DeliveryDispatcher dispatcher;
    private final Clock clock;
    private final String frontendUrl;
    private final Duration tickBudget;
    private final AtomicBoolean running = new AtomicBoolean();

    public ReminderScheduler(ReminderStore store, ReminderMatcher matcher, DeliveryDispatcher dispatcher,
                             Clock clock, HydrateProperties properties) {
        this.store = store;
        this.matcher = matcher;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.frontendUrl = properties.getFrontendUrl();
        this.tickBudget = properties.getScheduler().getTickBudget();
    }

    @Scheduled(cron = "${hydrate.scheduler.cron:0 * * * * *}")
    public void checkReminders() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous reminder tick still running, skipping this one");
            return;
        }
        try {
            TickReport report = runTick(clock.instant());
            if (report.hasActivity()) {
                log.info("Reminder tick: {}", report);
            } else {
                log.debug("Reminder tick: {}", report);
            }
        } catch (Exception e) {
            log.error("Reminder tick failed", e);
        } finally {
            running.set(false);
        }
    }

    /**
     * Evaluates every reminder against {@code now}. Only confirmed deliveries advance a
     * reminder's last-sent time; a gone endpoint removes its subscriber and the rest of its
     * reminders are not looked at.
     */
    public TickReport runTick(Instant now) {
        List<UserDocument> users = store.snapshot();
        long deadline = System.nanoTime() + tickBudget.toNanos();

        Map<String, Instant> sentAt = new HashMap<>();
        Set<String> gone = new HashSet<>();
        int evaluated = 0;
        int fired = 0;
        int delivered = 0;
        int transientFailures = 0;
        int skipped = 0;

        for (UserDocument user : users) {
            for (ReminderDocument reminder : user.getReminders()) {
                if (gone.contains(user.endpoint())) {
                    break;
                }
                if (System.nanoTime() - deadline >= 0) {
                    skipped++;
                    continue;
                }
                evaluated++;
                try {
                    if (!matcher.shouldFire(reminder, now)) {
                        continue;
                    }
                    fired++;
                    DeliveryOutcome outcome = dispatcher.deliver(user.getSubscription(),
                            NotificationPayloads.reminder(reminder.getTime(), frontendUrl));
                    if (outcome instanceof DeliveryOutcome.Delivered) {
                        sentAt.put(reminder.getId(), now);
                        delivered++;
                        log.info("Sent reminder {} to {} time {}", reminder.getId(), user.endpoint(), reminder.getTime());
                    } else if (outcome instanceof DeliveryOutcome.PermanentFailure permanent) {
                        gone.add(user.endpoint());
                        log.warn("Endpoint {} is gone ({}), removing subscriber {}",
                                user.endpoint(), permanent.statusCode(), user.getId());
                    } else if (outcome instanceof DeliveryOutcome.TransientFailure failure) {
                        transientFailures++;
                        log.warn("Send error for reminder {}: {}", reminder.getId(), failure.detail());
                    }
                } catch (Exception e) {
                    log.error("Reminder check error for {}", reminder.getId(), e);
                }
            }
        }

        if (skipped > 0) {
            log.warn("Tick budget of {} ms exceeded, {} reminders left for the next tick", tickBudget.toMillis(), skipped);
        }
        if (!sentAt.isEmpty() || !gone.isEmpty()) {
            store.commit(sentAt, gone);
        }
        return new TickReport(evaluated, fired, delivered, transientFailures, gone.size(), skipped);
    }
}
