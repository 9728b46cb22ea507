package com.example.cvmatch.text;

/** One word-like token of a text with its position in the (accent-stripped) source. */
public record Token(String raw, String norm, int start, int end) {}
