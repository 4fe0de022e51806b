package com.phillippitts.structurecoach.domain;

import com.phillippitts.structurecoach.exception.UnknownSectionException;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable answer-structuring framework: a name, an ordered list of sections, and a base
 * hint per section.
 *
 * @param name         framework name (e.g., "STAR")
 * @param sections     ordered, non-empty, duplicate-free section names
 * @param sectionHints base hint text for every section
 */
public record Framework(
        String name,
        List<String> sections,
        Map<String, String> sectionHints
) {

    /**
     * @throws IllegalArgumentException if sections are empty, duplicated, or missing a hint
     * @throws NullPointerException if any argument is null
     */
    public Framework {
        Objects.requireNonNull(name, "Framework name must not be null");
        Objects.requireNonNull(sections, "Sections must not be null");
        Objects.requireNonNull(sectionHints, "Section hints must not be null");
        if (sections.isEmpty()) {
            throw new IllegalArgumentException("Framework " + name + " must define at least one section");
        }
        Set<String> seen = new HashSet<>();
        for (String s : sections) {
            if (!seen.add(s)) {
                throw new IllegalArgumentException("Duplicate section '" + s + "' in framework " + name);
            }
            if (!sectionHints.containsKey(s)) {
                throw new IllegalArgumentException("Missing hint for section '" + s + "' in framework " + name);
            }
        }
        sections = List.copyOf(sections);
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String s : sections) {
            ordered.put(s, sectionHints.get(s));
        }
        sectionHints = Collections.unmodifiableMap(ordered);
    }

    public int totalSections() {
        return sections.size();
    }

    public boolean hasSection(String section) {
        return section != null && sectionHints.containsKey(section);
    }

    /**
     * Returns the base hint for a section.
     *
     * @throws UnknownSectionException if the section is not part of this framework
     */
    public String hintFor(String section) {
        if (!hasSection(section)) {
            throw new UnknownSectionException(section, name);
        }
        return sectionHints.get(section);
    }
}
