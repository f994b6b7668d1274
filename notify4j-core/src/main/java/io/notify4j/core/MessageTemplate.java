package io.notify4j.core;

public record MessageTemplate(String title, String message) {
}
