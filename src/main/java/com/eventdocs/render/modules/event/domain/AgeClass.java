package com.eventdocs.render.modules.event.domain;

public enum AgeClass {
    FULL(18),
    U18(16),
    U16(14),
    U14(0);

    private final int minimumAge;

    AgeClass(int minimumAge) {
        this.minimumAge = minimumAge;
    }

    public int getMinimumAge() {
        return minimumAge;
    }

    public boolean isMinor() {
        return this != FULL;
    }

    // Bands are checked top-down on their lower bounds.
    public static AgeClass of(int age) {
        if (age >= FULL.minimumAge) {
            return FULL;
        }
        if (age >= U18.minimumAge) {
            return U18;
        }
        if (age >= U16.minimumAge) {
            return U16;
        }
        return U14;
    }
}
