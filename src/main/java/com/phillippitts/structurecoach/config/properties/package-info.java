/**
 * Typed {@code @ConfigurationProperties} classes bound from application.properties.
 */
package com.phillippitts.structurecoach.config.properties;
