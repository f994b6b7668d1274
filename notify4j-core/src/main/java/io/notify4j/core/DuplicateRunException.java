package io.notify4j.core;

/**
 * A non-failed run already exists for the same {@code (jobId, scheduledAt)} pair.
 */
public class DuplicateRunException extends Notify4jException {

    private final String dedupeKey;

    public DuplicateRunException(String dedupeKey) {
        super("job run already exists: " + dedupeKey);
        this.dedupeKey = dedupeKey;
    }

    public String dedupeKey() {
        return dedupeKey;
    }
}
