package io.github.hydrate.protocol.api;

public record DeleteReminderRequest(String id) {}
