package io.github.hydrate.runtime.reminder;

import io.github.hydrate.persistence.document.ReminderDocument;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Decides whether a reminder is due at a given instant.
 * <p>
 * Local time is {@code utc - timezoneOffsetMinutes}, the sign convention of
 * {@code Date.getTimezoneOffset()} in the browser. Offsets are fixed; there is no DST table.
 * "Today" is the subscriber's local calendar day, and a repeat window never crosses midnight.
 */
@Component
public class ReminderMatcher {

    /** Minimum gap between two sends of the same reminder. */
    static final long DEBOUNCE_MS = 70_000;

    private static final long MINUTE_MS = 60_000;
    private static final int END_OF_MINUTE_NANOS = 999_000_000;

    public boolean shouldFire(ReminderDocument reminder, Instant nowUtc) {
        int offset = reminder.getTimezoneOffsetMinutes();
        LocalDateTime userLocal = LocalDateTime.ofInstant(nowUtc.minusSeconds(offset * 60L), ZoneOffset.UTC);
        Optional<ReminderTime> parsed = ReminderTime.parse(reminder.getTime() != null ? reminder.getTime() : "00:00");
        if (parsed.isEmpty()) {
            return false;
        }
        ReminderTime start = parsed.get();

        if (reminder.getRepeatEveryMinutes() <= 0) {
            return userLocal.getHour() == start.hour()
                    && userLocal.getMinute() == start.minute()
                    && outsideDebounce(reminder, nowUtc);
        }

        LocalDate today = userLocal.toLocalDate();
        Instant scheduledUtc = toUtc(today.atTime(start.hour(), start.minute()), offset);
        if (nowUtc.isBefore(scheduledUtc)) {
            return false;
        }

        String repeatUntil = reminder.getRepeatUntil();
        if (repeatUntil != null && !repeatUntil.isBlank()) {
            Optional<ReminderTime> until = ReminderTime.parse(repeatUntil);
            if (until.isEmpty()) {
                return false;
            }
            Instant untilUtc = toUtc(today.atTime(until.get().hour(), until.get().minute(), 59, END_OF_MINUTE_NANOS), offset);
            if (nowUtc.isAfter(untilUtc)) {
                return false;
            }
        }

        long diffMin = Math.floorDiv(nowUtc.toEpochMilli() - scheduledUtc.toEpochMilli(), MINUTE_MS);
        if (diffMin < 0) {
            return false;
        }
        return diffMin % reminder.getRepeatEveryMinutes() == 0 && outsideDebounce(reminder, nowUtc);
    }

    private static Instant toUtc(LocalDateTime local, int offsetMinutes) {
        return local.toInstant(ZoneOffset.UTC).plusSeconds(offsetMinutes * 60L);
    }

    private static boolean outsideDebounce(ReminderDocument reminder, Instant nowUtc) {
        Instant last = reminder.getLastSentISO();
        return last == null || nowUtc.toEpochMilli() - last.toEpochMilli() >= DEBOUNCE_MS;
    }
}
