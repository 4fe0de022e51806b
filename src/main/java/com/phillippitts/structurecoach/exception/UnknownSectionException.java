package com.phillippitts.structurecoach.exception;

/**
 * Thrown by the framework registry when a hint is requested for a section that the
 * framework does not define. Callers are expected to validate membership first.
 */
public class UnknownSectionException extends StructureCoachException {

    private final String sectionName;
    private final String frameworkName;

    public UnknownSectionException(String sectionName, String frameworkName) {
        super("Section '" + sectionName + "' is not defined by framework " + frameworkName);
        this.sectionName = sectionName;
        this.frameworkName = frameworkName;
    }

    public String getSectionName() {
        return sectionName;
    }

    public String getFrameworkName() {
        return frameworkName;
    }
}
