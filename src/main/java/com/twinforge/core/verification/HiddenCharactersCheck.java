package com.twinforge.core.verification;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rejects control characters that models sometimes emit into source files.
 */
@Component
@Order(30)
public class HiddenCharactersCheck implements VerificationCheck {

    private static final Pattern HIDDEN = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    @Override
    public String name() {
        return "files_no_hidden";
    }

    @Override
    public CheckVerdict check(ArtifactSet artifacts, ContractSlice slice) {
        List<String> offending = artifacts.files().entrySet().stream()
                .filter(e -> e.getValue() != null && HIDDEN.matcher(e.getValue()).find())
                .map(e -> e.getKey())
                .toList();
        if (!offending.isEmpty()) {
            return CheckVerdict.fail(name(), "Files with hidden chars: " + offending);
        }
        return CheckVerdict.ok(name(), "No hidden characters");
    }
}
