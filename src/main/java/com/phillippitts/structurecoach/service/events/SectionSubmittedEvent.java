package com.phillippitts.structurecoach.service.events;

import java.time.Instant;

/**
 * Emitted after a section answer is stored.
 *
 * @param practiceId practice the answer belongs to
 * @param questionIndex zero-based question index
 * @param sectionName submitted section
 * @param questionComplete whether every framework section of the question is now submitted
 * @param timestamp when the answer was stored
 */
public record SectionSubmittedEvent(
        long practiceId,
        int questionIndex,
        String sectionName,
        boolean questionComplete,
        Instant timestamp
) {}
