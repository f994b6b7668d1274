package io.notify4j.core;

import java.util.List;

public record RunHistory(List<JobRun> items, long total) {

    public RunHistory {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
