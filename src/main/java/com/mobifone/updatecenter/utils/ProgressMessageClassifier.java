package com.mobifone.updatecenter.utils;

import com.mobifone.updatecenter.entity.enumeration.ActivityType;

import java.util.Locale;

/**
 * Maps a free-text installer message to an activity type by substring match.
 * Approximate by nature; replace if the installer ever publishes structured events.
 */
public final class ProgressMessageClassifier {

    private ProgressMessageClassifier() {
    }

    public static ActivityType classify(String message) {
        if (message == null || message.isBlank()) return ActivityType.PROGRESS;
        String m = message.toLowerCase(Locale.ROOT);
        if (m.contains("error") || m.contains("fail")) return ActivityType.ERROR;
        if (m.contains("complete") || m.contains("success")) return ActivityType.SUCCESS;
        if (m.contains("install")) return ActivityType.INFO;
        return ActivityType.PROGRESS;
    }
}
