package io.github.hydrate.persistence.store;

/**
 * Validated fields of a reminder about to be created.
 */
public record ReminderSpec(
        String time,
        int timezoneOffsetMinutes,
        int repeatEveryMinutes,
        String repeatUntil
) {}
