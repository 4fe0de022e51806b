package com.phillippitts.structurecoach.service.progress;

import com.phillippitts.structurecoach.domain.Framework;
import com.phillippitts.structurecoach.domain.ProgressSnapshot;
import com.phillippitts.structurecoach.domain.SectionAnswer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a {@link ProgressSnapshot} from a framework and the stored answers of one question.
 *
 * <p>Pure function of its inputs. Submitted sections and times are reported in framework
 * order regardless of submission order; answers for sections outside the framework are
 * ignored.
 */
public final class ProgressCalculator {

    private ProgressCalculator() {}

    public static ProgressSnapshot snapshot(Framework framework, List<SectionAnswer> answers) {
        Map<String, SectionAnswer> bySection = latestBySection(answers);

        List<String> submitted = new ArrayList<>();
        Map<String, Integer> times = new LinkedHashMap<>();
        String next = null;
        for (String section : framework.sections()) {
            SectionAnswer a = bySection.get(section);
            if (a != null) {
                submitted.add(section);
                times.put(section, a.timeSpentSeconds());
            } else if (next == null) {
                next = section;
            }
        }

        int done = submitted.size();
        int total = framework.totalSections();
        boolean complete = next == null;
        String nextHint = complete ? null
                : ProgressHints.encouragement(done, next) + framework.hintFor(next);
        String message = complete ? ProgressHints.completion(framework.name())
                : ProgressHints.inProgress(done, total);

        return new ProgressSnapshot(framework.name(), submitted, done, total, next, nextHint,
                complete, times, message);
    }

    /**
     * Newest answer per section. The store keeps one row per section already; this guards
     * against callers passing raw history.
     */
    static Map<String, SectionAnswer> latestBySection(List<SectionAnswer> answers) {
        Map<String, SectionAnswer> latest = new LinkedHashMap<>();
        for (SectionAnswer a : answers) {
            latest.merge(a.sectionName(), a, (prev, cur) -> isNewer(cur, prev) ? cur : prev);
        }
        return latest;
    }

    private static boolean isNewer(SectionAnswer candidate, SectionAnswer current) {
        int cmp = candidate.submittedAt().compareTo(current.submittedAt());
        return cmp > 0 || (cmp == 0 && candidate.id() > current.id());
    }
}
