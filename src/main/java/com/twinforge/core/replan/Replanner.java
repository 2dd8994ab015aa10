package com.twinforge.core.replan;

import com.twinforge.core.model.FailureKind;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.SubsystemOutcome;
import com.twinforge.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a rejected iteration into structured feedback for the next one.
 * <p>
 * The feedback lists the judge's issues and recommendations, the diagnostics of every
 * exhausted target, the failure strategy and the previous plan summary. The revised plan
 * itself comes from the next planning call, which receives this feedback.
 */
@Service
public class Replanner {

    private static final Logger log = LoggerFactory.getLogger(Replanner.class);

    static final int MAX_ISSUES = 5;
    static final int MAX_RECOMMENDATIONS = 3;
    static final int MAX_TARGET_DIAGNOSTICS = 5;

    private final FailureClassifier classifier;

    public Replanner(FailureClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @param judgment the iteration's judgment, never null
     * @param outcomes the outcome of every target in the iteration
     */
    public ReplanDecision replan(String planSummary, JudgmentResult judgment, Map<Target, SubsystemOutcome> outcomes) {
        var diagnostics = new ArrayList<String>();
        var exhaustedLines = new ArrayList<String>();
        for (Target target : Target.values()) {
            SubsystemOutcome outcome = outcomes.get(target);
            if (outcome == null || !outcome.required() || !outcome.exhausted()) {
                continue;
            }
            List<String> last = outcome.lastDiagnostics();
            diagnostics.addAll(last);
            exhaustedLines.add("TARGET EXHAUSTED: " + target.wireName() + " failed verification "
                    + outcome.subIterations() + " time(s): "
                    + String.join("; ", last.subList(0, Math.min(MAX_TARGET_DIAGNOSTICS, last.size()))));
        }

        FailureKind kind = classifier.classify(diagnostics, !judgment.compatible());
        boolean stop = kind.stopsRun();

        var feedback = new ArrayList<String>();
        judgment.issues().stream().limit(MAX_ISSUES)
                .forEach(issue -> feedback.add("COMPATIBILITY ISSUE: " + issue));
        judgment.recommendations().stream().limit(MAX_RECOMMENDATIONS)
                .forEach(rec -> feedback.add("RECOMMENDATION: " + rec));
        feedback.addAll(exhaustedLines);
        feedback.add("FAILURE REASON: " + kind.reason());
        if (planSummary != null && !planSummary.isBlank()) {
            feedback.add("PREVIOUS PLAN: " + planSummary);
        }

        log.info("Replan: kind={}, severity={}, stop={}, {} feedback line(s)",
                kind, kind.severity(), stop, feedback.size());
        return new ReplanDecision(kind, stop, kind.reason(), feedback);
    }
}
