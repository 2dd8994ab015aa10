package com.twinforge.core.replan;

import com.twinforge.core.model.FailureKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Maps failure diagnostics to a {@link FailureKind} by keyword. The first matching rule wins,
 * so a permission problem outranks everything else.
 */
@Component
public class FailureClassifier {

    private record Rule(FailureKind kind, Predicate<String> matches) {}

    private static final List<Rule> RULES = List.of(
            new Rule(FailureKind.PERMISSION_DENIED,
                    s -> lower(s).contains("permission denied") || s.contains("Operation not permitted")),
            new Rule(FailureKind.TESTS_FAIL, s -> lower(s).contains("tests") || s.contains("FAILED")),
            new Rule(FailureKind.LINT_FAIL, s -> lower(s).contains("lint")),
            new Rule(FailureKind.BUILD_FAIL, s -> lower(s).contains("build")),
            new Rule(FailureKind.DEPLOY_FAIL, s -> lower(s).contains("deploy")),
            new Rule(FailureKind.CODEGEN_FAIL,
                    s -> lower(s).contains("missing files") || lower(s).contains("empty files")),
            new Rule(FailureKind.REFACTOR_FAIL, s -> lower(s).contains("refactor")));

    /**
     * @param diagnostics diagnostics of exhausted targets, oldest first
     * @param incompatible whether the judge reported an incompatibility
     */
    public FailureKind classify(List<String> diagnostics, boolean incompatible) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            return incompatible ? FailureKind.INCOMPATIBLE : FailureKind.VERIFY_FAIL;
        }
        for (Rule rule : RULES) {
            if (diagnostics.stream().anyMatch(d -> d != null && rule.matches().test(d))) {
                return rule.kind();
            }
        }
        return FailureKind.VERIFY_FAIL;
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
