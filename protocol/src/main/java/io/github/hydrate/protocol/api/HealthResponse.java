package io.github.hydrate.protocol.api;

public record HealthResponse(boolean ok, long time) {}
