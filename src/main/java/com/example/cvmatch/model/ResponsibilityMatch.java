package com.example.cvmatch.model;

/**
 * Best experience bullet found for one job responsibility. {@code bestBullet} is null when the
 * candidate has no bullets at all.
 */
public record ResponsibilityMatch(
        String responsibility,
        String bestBullet,
        double overlap
) {}
