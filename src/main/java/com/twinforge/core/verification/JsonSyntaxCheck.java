package com.twinforge.core.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.ContractSlice;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Map;

@Component
@Order(40)
public class JsonSyntaxCheck implements VerificationCheck {

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String name() {
        return "json_syntax";
    }

    @Override
    public CheckVerdict check(ArtifactSet artifacts, ContractSlice slice) {
        var errors = new ArrayList<String>();
        for (Map.Entry<String, String> file : artifacts.files().entrySet()) {
            if (!file.getKey().endsWith(".json") || file.getValue() == null || file.getValue().isBlank()) {
                continue;
            }
            try {
                mapper.readTree(file.getValue());
            } catch (JsonProcessingException e) {
                errors.add(file.getKey() + ": " + e.getOriginalMessage());
            }
        }
        if (!errors.isEmpty()) {
            return CheckVerdict.fail(name(), "JSON syntax errors: " + errors);
        }
        return CheckVerdict.ok(name(), "All JSON files parse");
    }
}
