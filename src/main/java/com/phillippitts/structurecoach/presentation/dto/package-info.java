/**
 * Request and response records for the REST API.
 *
 * <p>Field names are serialized in snake_case by the application-wide Jackson naming
 * strategy. Bean Validation annotations cover shape checks only; domain rules (valid
 * section names, question ranges) are enforced in the service layer.
 */
package com.phillippitts.structurecoach.presentation.dto;
