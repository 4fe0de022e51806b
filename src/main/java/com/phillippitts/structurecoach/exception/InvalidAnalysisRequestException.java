package com.phillippitts.structurecoach.exception;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when an analysis or practice request is malformed, e.g. an empty or unknown set of
 * analysis kinds. Carries the offending field and the acceptable values.
 */
public class InvalidAnalysisRequestException extends StructureCoachException {

    private final String field;
    private final List<String> acceptableValues;

    public InvalidAnalysisRequestException(String field, String problem, Collection<String> acceptableValues) {
        super(field + ": " + problem + (acceptableValues.isEmpty() ? "" : ". Acceptable values: " + acceptableValues));
        this.field = field;
        this.acceptableValues = List.copyOf(acceptableValues);
    }

    public String getField() {
        return field;
    }

    public List<String> getAcceptableValues() {
        return acceptableValues;
    }
}
