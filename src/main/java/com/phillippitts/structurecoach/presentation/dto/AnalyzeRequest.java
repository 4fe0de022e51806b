package com.phillippitts.structurecoach.presentation.dto;

import java.util.List;

/**
 * Optional body of the analysis endpoint. A missing body or missing {@code analysisTypes}
 * runs every dimension.
 */
public record AnalyzeRequest(List<String> analysisTypes) {
}
