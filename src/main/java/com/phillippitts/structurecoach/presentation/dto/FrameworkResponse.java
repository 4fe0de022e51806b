package com.phillippitts.structurecoach.presentation.dto;

import com.phillippitts.structurecoach.domain.Framework;

import java.util.List;

/**
 * A framework with its ordered sections and base hints.
 */
public record FrameworkResponse(String name, int totalSections, List<SectionView> sections) {

    public record SectionView(String name, String hint) {
    }

    public static FrameworkResponse from(Framework framework) {
        List<SectionView> sections = framework.sections().stream()
                .map(s -> new SectionView(s, framework.hintFor(s)))
                .toList();
        return new FrameworkResponse(framework.name(), framework.totalSections(), sections);
    }
}
