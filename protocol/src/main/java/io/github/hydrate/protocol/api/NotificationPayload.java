package io.github.hydrate.protocol.api;

/**
 * Body of a push message as the service worker reads it.
 */
public record NotificationPayload(
        String title,
        String body,
        String url
) {}
