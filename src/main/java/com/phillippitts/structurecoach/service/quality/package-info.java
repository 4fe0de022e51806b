/**
 * Per-section quality judgments: a model-backed judge and the deterministic heuristic used
 * whenever the model is disabled or fails.
 */
package com.phillippitts.structurecoach.service.quality;
