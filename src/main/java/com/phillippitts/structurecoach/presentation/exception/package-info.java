/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>Invalid section, question index, empty answer, invalid analysis request, invalid
 *       audio, body validation and malformed requests → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.structurecoach.exception.ResourceNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.structurecoach.exception.ReportSynthesisException} → 422 Unprocessable Entity</li>
 *   <li>{@link com.phillippitts.structurecoach.exception.TranscriptionException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.structurecoach.exception.StorageException} and {@code Exception} → 500</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "error_code": "InvalidSectionException",
 *   "message": "Invalid section name",
 *   "details": "Invalid section 'Intro' for framework STAR. Valid sections: [...]",
 *   "field": "section_name",
 *   "acceptable_values": ["Situation", "Task", "Action", "Result"],
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.structurecoach.presentation.exception;
