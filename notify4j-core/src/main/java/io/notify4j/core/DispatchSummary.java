package io.notify4j.core;

/**
 * Aggregate counts of a candidate batch.
 *
 * @param processed  one per (candidate, matching rule) pair, whatever the outcome
 * @param dispatched one per successful channel send
 */
public record DispatchSummary(int processed, int dispatched) {

    public static DispatchSummary empty() {
        return new DispatchSummary(0, 0);
    }
}
