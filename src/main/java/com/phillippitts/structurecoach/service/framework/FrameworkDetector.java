package com.phillippitts.structurecoach.service.framework;

import java.util.Optional;

/**
 * Strategy that classifies a free-text structure hint into a framework name.
 *
 * <p>Implementations must be pure: no side effects, deterministic for a given input, and
 * thread-safe. An empty result means "no opinion"; the registry then applies its default.
 *
 * @see MarkerFrameworkDetector
 * @see FrameworkRegistry#detectFramework(String)
 */
@FunctionalInterface
public interface FrameworkDetector {

    /**
     * @param structureHint structural description attached to a question (may be null or blank)
     * @return name of the matching framework, or empty if nothing matched
     */
    Optional<String> detect(String structureHint);
}
