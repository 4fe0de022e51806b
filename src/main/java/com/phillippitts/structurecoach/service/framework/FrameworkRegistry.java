package com.phillippitts.structurecoach.service.framework;

import com.phillippitts.structurecoach.domain.Framework;
import com.phillippitts.structurecoach.exception.ResourceNotFoundException;
import com.phillippitts.structurecoach.exception.UnknownSectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Lookup of known frameworks plus framework detection from a question's structure hint.
 *
 * <p>Detection is delegated to a pluggable {@link FrameworkDetector}; when the detector has
 * no opinion, or names a framework that is not registered, the default framework is
 * returned. Lookups by name are case-insensitive and ignore hyphens, so {@code "gcdio"}
 * resolves to {@code "G-C-D-I-O"}.
 *
 * <p><b>Thread Safety:</b> Registrations are stored in a concurrent map; lookups and
 * detection may run concurrently with registration.
 */
public class FrameworkRegistry {

    private static final Logger LOG = LogManager.getLogger(FrameworkRegistry.class);

    private final Map<String, Framework> byKey = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = new CopyOnWriteArrayList<>();
    private final FrameworkDetector detector;
    private final String defaultFrameworkName;

    /**
     * @param frameworks           initial frameworks
     * @param detector             detection strategy
     * @param defaultFrameworkName framework returned when detection finds nothing; must be registered
     * @throws IllegalArgumentException if the default framework is not among {@code frameworks}
     */
    public FrameworkRegistry(List<Framework> frameworks, FrameworkDetector detector, String defaultFrameworkName) {
        this.detector = Objects.requireNonNull(detector, "detector");
        frameworks.forEach(this::register);
        if (!byKey.containsKey(key(defaultFrameworkName))) {
            throw new IllegalArgumentException("Default framework not registered: " + defaultFrameworkName);
        }
        this.defaultFrameworkName = defaultFrameworkName;
    }

    /**
     * Registry with the built-in frameworks, marker detection, and STAR as the default.
     */
    public static FrameworkRegistry withBuiltIns() {
        return new FrameworkRegistry(Frameworks.builtIn(),
                new MarkerFrameworkDetector(Frameworks.builtInRules()),
                Frameworks.STAR);
    }

    /**
     * Registers (or replaces) a framework under its name.
     */
    public void register(Framework framework) {
        Objects.requireNonNull(framework, "framework");
        String k = key(framework.name());
        if (byKey.put(k, framework) == null) {
            registrationOrder.add(k);
        }
        LOG.debug("Registered framework {} with sections {}", framework.name(), framework.sections());
    }

    /**
     * Selects the framework for a structure hint. Pure apart from debug logging.
     *
     * @param structureHint structural description (null and blank allowed)
     * @return detected framework, or the default framework
     */
    public Framework detectFramework(String structureHint) {
        Optional<Framework> detected = detector.detect(structureHint).flatMap(this::find);
        return detected.orElseGet(this::defaultFramework);
    }

    public Framework defaultFramework() {
        return byKey.get(key(defaultFrameworkName));
    }

    public Optional<Framework> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(key(name)));
    }

    /**
     * @throws ResourceNotFoundException if no framework with this name is registered
     */
    public Framework require(String name) {
        return find(name).orElseThrow(() -> new ResourceNotFoundException("Framework", name));
    }

    public List<Framework> all() {
        List<Framework> out = new ArrayList<>(registrationOrder.size());
        registrationOrder.forEach(k -> out.add(byKey.get(k)));
        return out;
    }

    public List<String> sectionsFor(Framework framework) {
        return framework.sections();
    }

    /**
     * @throws UnknownSectionException if the section is not part of the framework
     */
    public String hintFor(Framework framework, String section) {
        return framework.hintFor(section);
    }

    private static String key(String name) {
        return name == null ? "" : name.replace("-", "").trim().toLowerCase(Locale.ROOT);
    }
}
