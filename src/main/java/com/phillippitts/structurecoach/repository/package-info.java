/**
 * Persistence: store interfaces and their JDBC implementations over the embedded database.
 *
 * <p>Upserts rely on unique keys and {@code MERGE ... KEY}; aggregate analyses and report
 * sections are stored as JSON documents.
 */
package com.phillippitts.structurecoach.repository;
