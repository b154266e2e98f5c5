package com.mobifone.updatecenter.entity.enumeration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

// State of the installer's progress handle, as reported on the wire ("starting", "running", ...)
public enum HandleState {
    STARTING,
    RUNNING,
    COMPLETE,
    ERROR,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR || this == CANCELLED;
    }

    @JsonCreator
    public static HandleState fromValue(String value) {
        if (value == null || value.isBlank()) return STARTING;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "complete", "completed", "success" -> COMPLETE;
            case "error", "failed" -> ERROR;
            case "cancelled", "canceled" -> CANCELLED;
            case "running" -> RUNNING;
            default -> STARTING;
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
