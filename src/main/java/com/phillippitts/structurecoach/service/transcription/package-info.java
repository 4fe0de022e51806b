/**
 * Speech-to-text for recorded sections.
 */
package com.phillippitts.structurecoach.service.transcription;
