/**
 * Micrometer instrumentation.
 */
package com.phillippitts.structurecoach.service.metrics;
