/**
 * Practice session bootstrap and lookup.
 */
package com.phillippitts.structurecoach.service.practice;
