package com.phillippitts.structurecoach.service.events;

import com.phillippitts.structurecoach.service.practice.PracticeService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Reacts to practice events off the request thread: logs them and flips a practice to
 * {@code completed} once every question has all of its sections.
 */
@Component
class PracticeEventsListener {

    private static final Logger LOG = LogManager.getLogger(PracticeEventsListener.class);

    private final PracticeService practiceService;

    PracticeEventsListener(PracticeService practiceService) {
        this.practiceService = practiceService;
    }

    @Async("eventExecutor")
    @EventListener
    void onSectionSubmitted(SectionSubmittedEvent e) {
        LOG.debug("Section submitted: practice={}, question={}, section={}, questionComplete={}",
                e.practiceId(), e.questionIndex(), e.sectionName(), e.questionComplete());
        if (e.questionComplete()) {
            practiceService.markCompletedIfDone(e.practiceId());
        }
    }

    @EventListener
    void onAnalysisCompleted(AnalysisCompletedEvent e) {
        if (e.failedKinds().isEmpty()) {
            LOG.info("Analysis stored: practice={}, question={}, composite={}",
                    e.practiceId(), e.questionIndex(), e.compositeScore());
        } else {
            LOG.warn("Analysis stored with degraded dimensions: practice={}, question={}, composite={}, failed={}",
                    e.practiceId(), e.questionIndex(), e.compositeScore(), e.failedKinds());
        }
    }
}
