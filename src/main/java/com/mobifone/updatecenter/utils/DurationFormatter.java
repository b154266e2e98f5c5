package com.mobifone.updatecenter.utils;

import java.time.Duration;
import java.time.LocalDateTime;

public final class DurationFormatter {

    private DurationFormatter() {
    }

    // 45s | 3m 7s | 2h 15m
    public static String format(long totalSeconds) {
        long s = Math.max(0, totalSeconds);
        if (s < 60) return s + "s";
        if (s < 3600) return (s / 60) + "m " + (s % 60) + "s";
        return (s / 3600) + "h " + ((s % 3600) / 60) + "m";
    }

    public static String relative(LocalDateTime then, LocalDateTime now) {
        if (then == null) return "";
        long s = Math.abs(Duration.between(then, now).getSeconds());
        if (s < 10) return "just now";
        if (s < 60) return s + "s ago";
        if (s < 3600) return (s / 60) + "m ago";
        return (s / 3600) + "h ago";
    }
}
