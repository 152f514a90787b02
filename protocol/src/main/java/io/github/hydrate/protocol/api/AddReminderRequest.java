package io.github.hydrate.protocol.api;

public record AddReminderRequest(
        PushSubscription subscription,
        String time,
        Integer timezoneOffsetMinutes,
        Integer repeatEveryMinutes,
        String repeatUntil
) {}
