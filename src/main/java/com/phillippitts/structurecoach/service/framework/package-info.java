/**
 * Reasoning frameworks and the pluggable detection of a question's framework from its
 * structure hint.
 */
package com.phillippitts.structurecoach.service.framework;
