/**
 * Whole-interview report synthesis: scoring (model or heuristic), score bands and feedback.
 */
package com.phillippitts.structurecoach.service.report;
