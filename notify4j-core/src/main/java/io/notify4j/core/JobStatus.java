package io.notify4j.core;

import java.util.Locale;

public enum JobStatus {
    ACTIVE {
        @Override
        public boolean isSchedulable() {
            return true;
        }
    },
    PAUSED {
        @Override
        public boolean isSchedulable() {
            return false;
        }
    },
    ARCHIVED {
        @Override
        public boolean isSchedulable() {
            return false;
        }
    };

    /**
     * Only schedulable jobs carry a {@code nextRunAt} and produce runs or reminders.
     */
    public abstract boolean isSchedulable();

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
