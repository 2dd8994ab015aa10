package com.twinforge.core.verification;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(20)
public class EmptyFilesCheck implements VerificationCheck {

    @Override
    public String name() {
        return "files_not_empty";
    }

    @Override
    public CheckVerdict check(ArtifactSet artifacts, ContractSlice slice) {
        List<String> empty = artifacts.files().entrySet().stream()
                .filter(e -> e.getValue() == null || e.getValue().isBlank())
                .map(e -> e.getKey())
                .toList();
        if (!empty.isEmpty()) {
            return CheckVerdict.fail(name(), "Empty files: " + empty);
        }
        return CheckVerdict.ok(name(), "All files have content");
    }
}
