package io.github.hydrate.runtime.reminder;

import java.util.Optional;

/**
 * A wall-clock time of day written as {@code H:MM} or {@code HH:MM}.
 */
public record ReminderTime(int hour, int minute) {

    public static Optional<ReminderTime> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String[] parts = text.trim().split(":");
        if (parts.length != 2) {
            return Optional.empty();
        }
        try {
            int hour = Integer.parseInt(parts[0].trim());
            int minute = Integer.parseInt(parts[1].trim());
            if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
                return Optional.empty();
            }
            return Optional.of(new ReminderTime(hour, minute));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return String.format("%02d:%02d", hour, minute);
    }
}
