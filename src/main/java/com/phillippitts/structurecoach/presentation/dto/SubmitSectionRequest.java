package com.phillippitts.structurecoach.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/practices/{id}/questions/{index}/sections}.
 */
public record SubmitSectionRequest(
        @NotBlank String sectionName,
        @NotBlank String answerText,
        @NotNull @Min(0) Integer timeSpentSeconds
) {
}
