package io.github.hydrate.runtime.reminder;

/**
 * Counters for one scheduler pass.
 *
 * @param evaluated         reminders checked against the clock
 * @param fired             reminders that matched and were handed to the dispatcher
 * @param delivered         sends accepted by the push service
 * @param transientFailures sends that failed and will be retried on a later tick
 * @param removedUsers      subscribers dropped because their endpoint is gone
 * @param skipped           reminders not evaluated because the tick ran out of time
 */
public record TickReport(
        int evaluated,
        int fired,
        int delivered,
        int transientFailures,
        int removedUsers,
        int skipped
) {
    public boolean hasActivity() {
        return fired > 0 || removedUsers > 0 || skipped > 0;
    }
}
