package com.example.cvmatch.model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A normalized competency. Two skills are equal when their {@code id} is equal, whatever
 * surface forms or display name they were seen with.
 */
public record Skill(
        String id,
        String name,
        SkillCategory category,
        Set<String> surfaceForms
) {
    public Skill {
        surfaceForms = surfaceForms == null ? Set.of()
                : Collections.unmodifiableSortedSet(new TreeSet<>(surfaceForms));
    }

    public Skill withSurfaceForms(Set<String> forms) {
        return new Skill(id, name, category, forms);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Skill other && id.equals(other.id));
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
