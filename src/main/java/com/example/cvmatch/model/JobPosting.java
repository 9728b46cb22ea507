package com.example.cvmatch.model;

public record JobPosting(
        String text,
        String title,
        String company
) {
    public static JobPosting of(String text) {
        return new JobPosting(text, null, null);
    }
}
