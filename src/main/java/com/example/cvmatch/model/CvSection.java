package com.example.cvmatch.model;

public enum CvSection {
    SUMMARY("summary"),
    SKILLS("skills"),
    EXPERIENCE("experience");

    private final String key;

    CvSection(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
