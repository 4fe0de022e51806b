/**
 * Actuator health contribution for external collaborators.
 */
package com.phillippitts.structurecoach.service.health;
