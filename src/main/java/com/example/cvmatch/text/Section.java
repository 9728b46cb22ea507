package com.example.cvmatch.text;

public record Section(SectionKind kind, String heading, String body) {}
