/**
 * Spring configuration: executors, framework registry wiring and collaborator selection.
 */
package com.phillippitts.structurecoach.config;
