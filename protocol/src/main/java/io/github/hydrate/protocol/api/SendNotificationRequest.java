package io.github.hydrate.protocol.api;

public record SendNotificationRequest(NotificationPayload payload) {}
