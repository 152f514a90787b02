package io.github.hydrate.protocol.api;

public record SubscribeResponse(boolean success, String userId) {}
