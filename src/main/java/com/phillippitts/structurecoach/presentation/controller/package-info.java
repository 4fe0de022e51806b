/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.structurecoach.presentation.controller.PracticeController}
 *       - {@code /api/practices}: create and read practices, submit sections (JSON or
 *       multipart audio), read progress, run analysis</li>
 *   <li>{@link com.phillippitts.structurecoach.presentation.controller.FrameworkController}
 *       - {@code /api/frameworks}: registered frameworks and their section hints</li>
 *   <li>{@link com.phillippitts.structurecoach.presentation.controller.ReportController}
 *       - {@code /api/interviews/{id}/report}: generate and read whole-interview reports</li>
 * </ul>
 *
 * <p>Controller Responsibilities:
 * <ul>
 *   <li>Accept HTTP requests and extract parameters</li>
 *   <li>Validate request shape (domain validation lives in services)</li>
 *   <li>Delegate to the service layer and convert results to DTOs</li>
 *   <li>Let {@code GlobalExceptionHandler} handle exceptions</li>
 * </ul>
 *
 * @see com.phillippitts.structurecoach.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.structurecoach.presentation.controller;
