package io.github.hydrate.protocol.api;

import java.util.List;

public record RemindersResponse(boolean success, List<ReminderDto> reminders) {}
