package com.twinforge.core.verification;

import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class ArtifactsPresentCheck implements VerificationCheck {

    @Override
    public String name() {
        return "artifacts_present";
    }

    @Override
    public CheckVerdict check(ArtifactSet artifacts, ContractSlice slice) {
        if (artifacts.isEmpty()) {
            return CheckVerdict.fail(name(), "Missing files: no files were generated");
        }
        return CheckVerdict.ok(name(), artifacts.size() + " file(s) present");
    }
}
