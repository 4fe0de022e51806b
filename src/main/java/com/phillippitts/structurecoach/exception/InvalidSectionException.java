package com.phillippitts.structurecoach.exception;

import java.util.List;

/**
 * Thrown when a submitted section name is not part of the question's assigned framework.
 * The message enumerates the valid section names so the client can correct the request.
 */
public class InvalidSectionException extends StructureCoachException {

    private final String sectionName;
    private final String frameworkName;
    private final List<String> validSections;

    public InvalidSectionException(String sectionName, String frameworkName, List<String> validSections) {
        super("Invalid section '" + sectionName + "' for framework " + frameworkName
                + ". Valid sections: " + validSections);
        this.sectionName = sectionName;
        this.frameworkName = frameworkName;
        this.validSections = List.copyOf(validSections);
    }

    public String getSectionName() {
        return sectionName;
    }

    public String getFrameworkName() {
        return frameworkName;
    }

    public List<String> getValidSections() {
        return validSections;
    }
}
