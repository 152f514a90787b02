package io.github.hydrate.protocol.api;

import java.util.List;

public record BroadcastResponse(boolean success, List<DeliveryResultDto> results) {}
