package com.phillippitts.structurecoach.service.quality;

import com.phillippitts.structurecoach.domain.QualityJudgment;

/**
 * Judges how well each submitted section of an answer is developed.
 *
 * <p>Implementations only return qualities for submitted sections; the caller treats every
 * other framework section as missing.
 */
public interface QualityJudge {

    /**
     * @throws com.phillippitts.structurecoach.exception.CollaboratorUnavailableException
     *         if a remote judge cannot be reached or returns something unusable
     */
    QualityJudgment judge(QualityRequest request);

    /** Short name for logs and health details. */
    String name();
}
