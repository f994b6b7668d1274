package io.notify4j.core;

public enum ScopeType {
    FLEET,
    YACHT,
    ENTITY
}
