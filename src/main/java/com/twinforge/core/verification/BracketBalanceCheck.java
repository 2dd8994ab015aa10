package com.twinforge.core.verification;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import com.twinforge.core.model.Target;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Cheap syntax sanity check for JavaScript and TypeScript sources: brackets outside
 * string literals must balance. Catches replies that were cut off mid-file.
 */
@Component
@Order(50)
public class BracketBalanceCheck implements VerificationCheck {

    private static final List<String> SCRIPT_EXTENSIONS = List.of(".js", ".jsx", ".ts", ".tsx");
    private static final Map<Character, Character> PAIRS = Map.of('(', ')', '{', '}', '[', ']');

    @Override
    public String name() {
        return "js_brackets";
    }

    @Override
    public boolean appliesTo(Target target) {
        return target == Target.FRONTEND;
    }

    @Override
    public CheckVerdict check(ArtifactSet artifacts, ContractSlice slice) {
        var errors = new ArrayList<String>();
        for (Map.Entry<String, String> file : artifacts.files().entrySet()) {
            if (SCRIPT_EXTENSIONS.stream().noneMatch(file.getKey()::endsWith) || file.getValue() == null) {
                continue;
            }
            String problem = firstImbalance(file.getValue());
            if (problem != null) {
                errors.add(file.getKey() + ": " + problem);
            }
        }
        if (!errors.isEmpty()) {
            return CheckVerdict.fail(name(), "JS syntax issues: " + errors);
        }
        return CheckVerdict.ok(name(), "All script files have balanced brackets");
    }

    static String firstImbalance(String content) {
        Deque<Character> stack = new ArrayDeque<>();
        char quote = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if ((c == '"' || c == '\'' || c == '`') && (i == 0 || content.charAt(i - 1) != '\\')) {
                if (quote == 0) {
                    quote = c;
                } else if (quote == c) {
                    quote = 0;
                }
                continue;
            }
            if (quote != 0) {
                continue;
            }
            if (PAIRS.containsKey(c)) {
                stack.push(c);
            } else if (PAIRS.containsValue(c)) {
                if (stack.isEmpty()) {
                    return "Unmatched closing bracket '" + c + "'";
                }
                if (PAIRS.get(stack.pop()) != c) {
                    return "Mismatched brackets";
                }
            }
        }
        return stack.isEmpty() ? null : "Unclosed brackets: " + stack;
    }
}
