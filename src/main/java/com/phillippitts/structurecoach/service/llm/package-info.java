/**
 * HTTP access to the generative-text collaborator.
 */
package com.phillippitts.structurecoach.service.llm;
