package io.notify4j.core;

/**
 * Informational replay hint. Not used to gate dispatch timing.
 */
public record CadencePolicy(CadenceMode mode, Integer value) {

    public CadencePolicy {
        mode = mode == null ? CadenceMode.DAILY : mode;
    }

    public static CadencePolicy daily() {
        return new CadencePolicy(CadenceMode.DAILY, null);
    }
}
