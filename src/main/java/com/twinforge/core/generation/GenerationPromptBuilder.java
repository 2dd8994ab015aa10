package com.twinforge.core.generation;

import com.twinforge.core.collaborator.GenerationRequest;
import com.twinforge.core.model.ContractSlice;
import com.twinforge.core.model.DataModel;
import com.twinforge.core.model.Endpoint;
import com.twinforge.core.model.Target;

import java.util.Map;

/**
 * Converts a {@link GenerationRequest} into the instruction text sent to a code generator.
 * Pure function, no Spring dependencies.
 */
public final class GenerationPromptBuilder {

    private static final int MAX_PRIOR_FILES_LISTED = 40;

    private GenerationPromptBuilder() {}

    public static String systemPrompt(Target target) {
        return target == Target.BACKEND
                ? "You are a senior backend developer with a tech lead mindset. You write complete, runnable "
                  + "server code that implements an API contract exactly."
                : "You are a senior frontend developer with a tech lead mindset. You write complete, runnable "
                  + "client code that consumes an API contract exactly.";
    }

    public static String build(GenerationRequest request) {
        var sb = new StringBuilder();
        Target target = request.target();

        sb.append("=== GOAL ===\n").append(request.goal()).append("\n\n");

        if (!request.runFeedback().isEmpty()) {
            sb.append("=== FEEDBACK FROM THE PREVIOUS ITERATION ===\n");
            for (String line : request.runFeedback()) {
                sb.append("- ").append(line).append("\n");
            }
            sb.append("\n");
        }

        if (!request.diagnostics().isEmpty()) {
            sb.append("=== PREVIOUS FAILURE REASONS (FIX THESE!) ===\n");
            sb.append("The previous attempt failed verification. You MUST fix these issues:\n");
            for (String line : request.diagnostics()) {
                sb.append("- ").append(line).append("\n");
            }
            sb.append("\n");
        }

        if (request.planText() != null && !request.planText().isBlank()) {
            sb.append("=== PLAN ===\n").append(request.planText()).append("\n\n");
        }

        appendContract(sb, request.slice());

        if (!request.priorArtifacts().isEmpty()) {
            sb.append("=== EXISTING FILES (refine them, keep what works) ===\n");
            request.priorArtifacts().paths().stream()
                    .limit(MAX_PRIOR_FILES_LISTED)
                    .forEach(p -> sb.append("- ").append(p).append("\n"));
            sb.append("\n");
        }

        sb.append("=== STRICT ROLE SEPARATION ===\n");
        if (target == Target.BACKEND) {
            sb.append("You are the BACKEND developer ONLY. Generate only server-side files. ");
            sb.append("Do NOT generate frontend files; a separate developer owns them.\n");
            sb.append("- Implement every endpoint with the exact method and path.\n");
            sb.append("- Configure CORS for the listed origins.\n");
            sb.append("- The server must start with a single command and listen on the base URL's port.\n\n");
        } else {
            sb.append("You are the FRONTEND developer ONLY. Generate only client-side files. ");
            sb.append("Do NOT generate backend files; a separate developer owns them.\n");
            sb.append("- Call every listed endpoint with the exact method and path against the base URL.\n");
            sb.append("- Include a package manifest so the client builds without manual steps.\n\n");
        }

        sb.append("=== OUTPUT FORMAT ===\n");
        sb.append("Return every file as:\n");
        sb.append("FILE: relative/path.ext\n```lang\n<full content>\n```\n");
        sb.append("Use paths relative to the ").append(target.wireName()).append(" root. ");
        sb.append("Write code, comments and strings in English. Do not create markdown documentation files.\n");

        return sb.toString();
    }

    private static void appendContract(StringBuilder sb, ContractSlice slice) {
        sb.append("=== API CONTRACT (MUST MATCH EXACTLY) ===\n");
        sb.append("Base URL: ").append(slice.baseUrl()).append("\n");
        if (slice.endpoints().isEmpty()) {
            sb.append("No endpoints defined.\n");
        }
        for (Endpoint e : slice.endpoints()) {
            sb.append("- ").append(e.signature());
            if (e.description() != null && !e.description().isBlank()) {
                sb.append(" : ").append(e.description());
            }
            sb.append("\n");
            if (e.requestShape() != null && !e.requestShape().isBlank()) {
                sb.append("    request: ").append(e.requestShape()).append("\n");
            }
            if (e.responseShape() != null && !e.responseShape().isBlank()) {
                sb.append("    response: ").append(e.responseShape()).append("\n");
            }
        }
        if (!slice.dataModels().isEmpty()) {
            sb.append("Data models:\n");
            for (DataModel m : slice.dataModels()) {
                sb.append("- ").append(m.name()).append(" { ");
                int i = 0;
                for (Map.Entry<String, String> f : m.fields().entrySet()) {
                    if (i++ > 0) {
                        sb.append(", ");
                    }
                    sb.append(f.getKey()).append(": ").append(f.getValue());
                }
                sb.append(" }\n");
            }
        }
        if (slice.frontend() != null) {
            var fe = slice.frontend();
            if (!fe.pages().isEmpty()) {
                sb.append("Pages: ").append(String.join(", ", fe.pages())).append("\n");
            }
            if (!fe.components().isEmpty()) {
                sb.append("Components: ").append(String.join(", ", fe.components())).append("\n");
            }
            if (fe.stateManagement() != null && !fe.stateManagement().isBlank()) {
                sb.append("State management: ").append(fe.stateManagement()).append("\n");
            }
        }
        if (slice.integration() != null) {
            if (!slice.integration().corsOrigins().isEmpty()) {
                sb.append("CORS origins: ").append(String.join(", ", slice.integration().corsOrigins())).append("\n");
            }
            sb.append("Auth: ").append(slice.integration().authMethod()).append("\n");
        }
        sb.append("\n");
    }
}
