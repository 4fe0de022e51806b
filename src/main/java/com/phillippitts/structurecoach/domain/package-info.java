/**
 * Immutable domain model: frameworks, practice sessions, section answers, progress
 * snapshots, analysis results and reports.
 */
package com.phillippitts.structurecoach.domain;
