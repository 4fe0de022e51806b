package com.phillippitts.structurecoach.presentation.dto;

import com.phillippitts.structurecoach.domain.QuestionSpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Body of {@code POST /api/practices}.
 *
 * <p>Either {@code interviewId} (reuse an interview's questions) or {@code track} plus
 * {@code questions} (create a new interview) is given.
 */
public record CreatePracticeRequest(
        @Positive Long interviewId,
        @Size(max = 200) String track,
        @Valid List<QuestionRequest> questions
) {

    public record QuestionRequest(
            @NotBlank @Size(max = 2000) String text,
            @Size(max = 500) String structureHint
    ) {
        QuestionSpec toSpec() {
            return new QuestionSpec(text.trim(), structureHint);
        }
    }

    public List<QuestionSpec> questionSpecs() {
        return questions == null ? List.of() : questions.stream().map(QuestionRequest::toSpec).toList();
    }
}
