/**
 * Independent analysis dimensions run concurrently by the aggregator.
 */
package com.phillippitts.structurecoach.service.analysis.dimension;
