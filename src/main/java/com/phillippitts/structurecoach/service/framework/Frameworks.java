package com.phillippitts.structurecoach.service.framework;

import com.phillippitts.structurecoach.domain.Framework;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in framework definitions and their detection rules.
 */
public final class Frameworks {

    public static final String STAR = "STAR";
    public static final String GCDIO = "G-C-D-I-O";
    public static final String CTETD = "C-T-E-T-D";

    private Frameworks() {}

    /** Behavioral framework; also the default when nothing is detected. */
    public static Framework star() {
        Map<String, String> hints = new LinkedHashMap<>();
        hints.put("Situation", "Describe the context. What was happening? Where were you? What was the challenge or scenario?");
        hints.put("Task", "Define your responsibility. What was your specific role? What were you asked to do?");
        hints.put("Action", "Explain your actions. What specific steps did you take? How did you approach the problem?");
        hints.put("Result", "Share the outcome. What happened? What were the measurable results? What did you learn?");
        return new Framework(STAR, List.copyOf(hints.keySet()), hints);
    }

    /** System-design framework. */
    public static Framework gcdio() {
        Map<String, String> hints = new LinkedHashMap<>();
        hints.put("Goal", "State the objective. What were you trying to achieve? What problem needed solving?");
        hints.put("Constraints", "Identify limitations. What constraints did you face? (time, resources, requirements, etc.)");
        hints.put("Decision", "Explain your choice. What approach did you decide on? Why did you choose it over alternatives?");
        hints.put("Implementation", "Describe execution. How did you implement your decision? What specific steps or code?");
        hints.put("Outcome", "Share results. What was the impact? Did you meet the goal? What were the trade-offs?");
        return new Framework(GCDIO, List.copyOf(hints.keySet()), hints);
    }

    /** Technical-concept framework. */
    public static Framework ctetd() {
        Map<String, String> hints = new LinkedHashMap<>();
        hints.put("Context", "Set the stage. Explain the background, scenario, or environment where this concept applies.");
        hints.put("Theory", "Define the core concept. Explain how it works, key principles, or the underlying mechanism.");
        hints.put("Example", "Provide a concrete example. Show working code, a real scenario, or a practical demonstration.");
        hints.put("Trade-offs", "Discuss pros and cons. What are the benefits? What are the limitations or downsides?");
        hints.put("Decision", "Conclude with your recommendation. When would you use this? What's your best practice?");
        return new Framework(CTETD, List.copyOf(hints.keySet()), hints);
    }

    public static List<Framework> builtIn() {
        return List.of(star(), gcdio(), ctetd());
    }

    /**
     * Detection rules in priority order: STAR, then G-C-D-I-O, then C-T-E-T-D.
     */
    public static List<MarkerFrameworkDetector.Rule> builtInRules() {
        return List.of(
                MarkerFrameworkDetector.Rule.of(STAR, List.of("star", "situation"), List.of()),
                MarkerFrameworkDetector.Rule.of(GCDIO, List.of("gcdio", "g-c-d-i-o"), List.of("goal", "constraint")),
                MarkerFrameworkDetector.Rule.of(CTETD, List.of("ctetd", "c-t-e-t-d"), List.of("theory", "trade-off"))
        );
    }
}
