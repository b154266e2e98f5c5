package com.mobifone.updatecenter.utils;

import com.mobifone.updatecenter.entity.enumeration.UpdateLevel;

import java.util.Optional;

/**
 * Classifies the gap between two dotted version strings.
 * <p>
 * Components are compared left to right. Missing components count as {@code 0};
 * components that are not both numeric are compared as plain strings. The first
 * differing component decides the level: index 0 is MAJOR, index 1 is MINOR and
 * anything further right is PATCH.
 */
public final class VersionComparator {

    private VersionComparator() {
    }

    /** @return the update level, or empty when the versions are identical */
    public static Optional<UpdateLevel> classify(String from, String to) {
        String[] a = split(from);
        String[] b = split(to);
        int len = Math.max(a.length, b.length);
        for (int i = 0; i < len; i++) {
            String x = i < a.length ? a[i] : "0";
            String y = i < b.length ? b[i] : "0";
            if (!same(x, y)) {
                return Optional.of(levelAt(i));
            }
        }
        return Optional.empty();
    }

    public static boolean matches(String installed, String expected) {
        if (installed == null || expected == null) return false;
        return classify(installed, expected).isEmpty();
    }

    private static UpdateLevel levelAt(int index) {
        if (index == 0) return UpdateLevel.MAJOR;
        if (index == 1) return UpdateLevel.MINOR;
        return UpdateLevel.PATCH;
    }

    private static boolean same(String x, String y) {
        Long nx = asNumber(x);
        Long ny = asNumber(y);
        if (nx != null && ny != null) {
            return nx.longValue() == ny.longValue();
        }
        return x.equals(y);
    }

    private static Long asNumber(String s) {
        if (s.isEmpty()) return 0L;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return null;
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return null; // overflow, fall back to string comparison
        }
    }

    private static String[] split(String version) {
        if (version == null || version.isBlank()) return new String[0];
        return version.trim().split("\\.");
    }
}
