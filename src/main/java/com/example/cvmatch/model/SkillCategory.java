package com.example.cvmatch.model;

public enum SkillCategory {
    LANGUAGE,
    FRAMEWORK,
    TOOL,
    CERTIFICATION,
    SOFT_SKILL,
    METHODOLOGY,
    UNCATEGORIZED
}
