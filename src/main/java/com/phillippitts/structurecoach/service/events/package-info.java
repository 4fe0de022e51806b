/**
 * Application events published by the practice flow and their listener.
 */
package com.phillippitts.structurecoach.service.events;
