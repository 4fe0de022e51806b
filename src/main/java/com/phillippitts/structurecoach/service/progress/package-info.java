/**
 * Section-by-section progress for one practice question: submission, snapshots and hints.
 */
package com.phillippitts.structurecoach.service.progress;
