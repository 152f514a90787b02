package io.github.hydrate.runtime.push;

import io.github.hydrate.protocol.api.NotificationPayload;

public final class NotificationPayloads {

    static final String REMINDER_TITLE = "Hydrate — Reminder";
    static final String BROADCAST_TITLE = "Hydrate";

    private NotificationPayloads() {}

    public static NotificationPayload reminder(String time, String frontendUrl) {
        return new NotificationPayload(REMINDER_TITLE, "Time: " + time + " — Drink water 💧", frontendUrl);
    }

    public static NotificationPayload broadcast(String frontendUrl) {
        return new NotificationPayload(BROADCAST_TITLE, "Time to drink water 💧", frontendUrl);
    }
}
