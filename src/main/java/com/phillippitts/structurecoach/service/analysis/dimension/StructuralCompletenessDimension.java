package com.phillippitts.structurecoach.service.analysis.dimension;

import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.SectionAnswer;
import com.phillippitts.structurecoach.service.analysis.AnalysisContext;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coverage of the framework: which sections are present, which are missing, and whether the
 * candidate recorded them in framework order.
 */
@Component
public class StructuralCompletenessDimension implements AnalysisDimension {

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.STRUCTURAL_COMPLETENESS;
    }

    @Override
    public Map<String, Object> analyze(AnalysisContext context) {
        List<String> frameworkOrder = context.framework().sections();
        List<String> submitted = context.answers().stream().map(SectionAnswer::sectionName).toList();
        List<String> missing = frameworkOrder.stream().filter(s -> !submitted.contains(s)).toList();
        List<String> recordedOrder = context.answers().stream()
                .sorted(Comparator.comparing(SectionAnswer::submittedAt).thenComparingLong(SectionAnswer::id))
                .map(SectionAnswer::sectionName)
                .toList();

        int total = frameworkOrder.size();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("framework", context.framework().name());
        payload.put("sections_covered", submitted.size());
        payload.put("total_sections", total);
        payload.put("coverage_percent", Math.round(submitted.size() * 100.0 / total));
        payload.put("missing_sections", missing);
        payload.put("submission_order", recordedOrder);
        payload.put("followed_framework_order", recordedOrder.equals(submitted));
        return payload;
    }
}
