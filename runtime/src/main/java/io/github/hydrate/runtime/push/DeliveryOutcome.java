package io.github.hydrate.runtime.push;

/**
 * Result of one push attempt. Status codes are interpreted only by {@link DeliveryDispatcher}.
 */
public sealed interface DeliveryOutcome {

    /** Accepted by the push service. */
    record Delivered(int statusCode) implements DeliveryOutcome {}

    /** Failed for a reason that leaves the subscription valid; retried on a later tick. */
    record TransientFailure(String detail) implements DeliveryOutcome {}

    /** The endpoint no longer exists; the subscriber must be dropped. */
    record PermanentFailure(int statusCode) implements DeliveryOutcome {}

    default boolean isDelivered() {
        return this instanceof Delivered;
    }
}
