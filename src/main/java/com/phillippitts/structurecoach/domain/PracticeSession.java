package com.phillippitts.structurecoach.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A practice run: an ordered set of questions, each with its framework.
 *
 * @param id          practice identifier
 * @param interviewId interview the questions belong to
 * @param track       interview track (e.g., "Backend Engineering")
 * @param status      lifecycle status
 * @param questions   questions ordered by index
 * @param createdAt   creation time
 */
public record PracticeSession(
        long id,
        long interviewId,
        String track,
        PracticeStatus status,
        List<PracticeQuestion> questions,
        Instant createdAt
) {

    public PracticeSession {
        Objects.requireNonNull(track, "Track must not be null");
        Objects.requireNonNull(status, "Status must not be null");
        questions = List.copyOf(questions);
        Objects.requireNonNull(createdAt, "Created-at must not be null");
    }

    public int questionCount() {
        return questions.size();
    }
}
