package com.example.cvmatch.model;

/**
 * Closed set of industries used to vary advisory phrasing. {@link #GENERAL} is the fallback
 * when no trigger term of any other category appears in the posting.
 */
public enum IndustryCategory {
    SOFTWARE,
    DATA,
    FINANCE,
    HEALTHCARE,
    MARKETING,
    GENERAL
}
