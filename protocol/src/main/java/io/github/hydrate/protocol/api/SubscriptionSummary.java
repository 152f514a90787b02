package io.github.hydrate.protocol.api;

import java.util.List;

public record SubscriptionSummary(int count, List<UserSummary> users) {

    /** One subscriber with the number of reminders it owns. */
    public record UserSummary(String id, int reminders) {}
}
