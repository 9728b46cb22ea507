package com.example.cvmatch.model;

public enum ExperienceLevel {
    ENTRY(0),
    MID(1),
    SENIOR(2),
    UNSPECIFIED(-1);

    private final int band;

    ExperienceLevel(int band) {
        this.band = band;
    }

    public int band() {
        return band;
    }

    public boolean isSpecified() {
        return this != UNSPECIFIED;
    }

    /** Under 2 years is entry, under 5 is mid, anything above is senior. */
    public static ExperienceLevel fromYears(Integer years) {
        if (years == null || years < 0) return UNSPECIFIED;
        if (years < 2) return ENTRY;
        if (years < 5) return MID;
        return SENIOR;
    }

    public static ExperienceLevel higherOf(ExperienceLevel a, ExperienceLevel b) {
        return a.band >= b.band ? a : b;
    }
}
