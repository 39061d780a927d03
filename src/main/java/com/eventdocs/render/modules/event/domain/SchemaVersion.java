package com.eventdocs.render.modules.event.domain;

/**
 * Export schema version, ordered lexicographically on (major, minor).
 */
public record SchemaVersion(int major, int minor) implements Comparable<SchemaVersion> {

    public static SchemaVersion of(int major, int minor) {
        return new SchemaVersion(major, minor);
    }

    @Override
    public int compareTo(SchemaVersion other) {
        int result = Integer.compare(major, other.major);
        return result != 0 ? result : Integer.compare(minor, other.minor);
    }

    public boolean isWithin(SchemaVersion minimum, SchemaVersion maximum) {
        return compareTo(minimum) >= 0 && compareTo(maximum) <= 0;
    }

    @Override
    public String toString() {
        return minor == Integer.MAX_VALUE ? major + ".*" : major + "." + minor;
    }
}
