/**
 * Request-scoped logging context.
 */
package com.phillippitts.structurecoach.config.logging;
