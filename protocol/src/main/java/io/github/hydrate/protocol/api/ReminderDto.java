package io.github.hydrate.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReminderDto(
        String id,
        String time,
        int timezoneOffsetMinutes,
        int repeatEveryMinutes,
        String repeatUntil,
        @JsonProperty("lastSentISO") String lastSentISO
) {}
