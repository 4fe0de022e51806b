/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.structurecoach.exception.StructureCoachException} - Base exception</li>
 *   <li>Validation: {@code InvalidSectionException}, {@code QuestionIndexOutOfRangeException},
 *       {@code EmptyAnswerException}, {@code InvalidAnalysisRequestException}</li>
 *   <li>Lookup: {@code ResourceNotFoundException}, {@code UnknownSectionException}</li>
 *   <li>Per-dimension (recovered inside the aggregator): {@code AnalysisTimeoutException},
 *       {@code AnalysisFailureException}</li>
 *   <li>Collaborators: {@code TranscriptionException}, {@code CollaboratorUnavailableException}</li>
 *   <li>Fatal per call: {@code ReportSynthesisException}, {@code StorageException}</li>
 * </ul>
 *
 * <p>Validation errors are raised before any state mutation. All exceptions map to HTTP
 * responses via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.structurecoach.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.structurecoach.exception;
