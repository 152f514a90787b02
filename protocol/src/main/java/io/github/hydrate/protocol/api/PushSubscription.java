package io.github.hydrate.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A browser push subscription as produced by {@code PushManager.subscribe()}.
 * The endpoint is the identity; expiration and keys are carried through to the push service untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PushSubscription(
        String endpoint,
        Long expirationTime,
        Keys keys
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Keys(String p256dh, String auth) {}

    public boolean hasEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }
}
