/**
 * Presentation layer (REST API controllers, DTOs and exception handling).
 *
 * <p>This package contains the HTTP/REST boundary of the application, following a
 * 3-tier architecture where presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.dto} - Request/response records for API contracts</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Controllers are thin adapters - business logic lives in services</li>
 *   <li>Exception handlers map domain exceptions to HTTP status codes</li>
 *   <li>Controllers never throw HTTP-specific exceptions (use domain exceptions)</li>
 * </ul>
 *
 * @see com.phillippitts.structurecoach.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.structurecoach.presentation;
