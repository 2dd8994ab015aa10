package com.twinforge.core.planning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.twinforge.core.collaborator.CollaboratorException;
import com.twinforge.core.collaborator.PlanningCollaborator;
import com.twinforge.core.llm.LlmService;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.Contract;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.PlanResult;
import com.twinforge.core.model.RunPlan;
import com.twinforge.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Plans runs and judges compatibility with the chat model.
 * <p>
 * Planning returns a {@link RunPlan} through structured output; judgment shows the model the
 * contract and the first lines of every generated file and returns a {@link JudgeResponse}.
 */
public class LlmPlanningCollaborator implements PlanningCollaborator {

    private static final Logger log = LoggerFactory.getLogger(LlmPlanningCollaborator.class);

    static final int SAMPLE_LINES = 100;

    private static final String PLAN_SYSTEM_PROMPT = """
            You are a senior project architect applying multi-view analysis.
            Analyze the goal from these perspectives at once:
            1. PM view: scope and deliverables
            2. Tech lead view: architecture, API design, data flow
            3. UX view: user interactions and frontend requirements
            4. Integration view: how the components connect

            Decide whether the goal needs a backend, a frontend, or both. At least one is required.
            When a backend is needed, define EVERY endpoint with method, path (/api/...),
            request shape and response shape, plus the data models.
            When a frontend is needed, list its pages, components, the endpoints each calls
            (as "METHOD /path") and the state management approach.
            Describe the integration contract: base URL, CORS origins, authentication.

            Respond with valid JSON matching the schema provided.
            """;

    private static final String JUDGE_SYSTEM_PROMPT = """
            You are a senior technical reviewer and integration specialist.
            Perform a deep compatibility analysis between the backend and frontend code.

            Check:
            1. API endpoint matching: does the backend implement every endpoint of the contract,
               does the frontend call every endpoint it needs, are methods and paths identical?
            2. Request/response format: do request bodies and response fields line up?
            3. Base URL configuration and CORS.
            4. Data flow: can the frontend consume every backend response?

            Report endpoints as "METHOD /path". Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public LlmPlanningCollaborator(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public PlanResult plan(String goal, List<String> feedback) {
        String userPrompt = buildPlanPrompt(goal, feedback);
        RunPlan runPlan;
        try {
            runPlan = llmService.structuredCall(PLAN_SYSTEM_PROMPT, userPrompt, RunPlan.class);
        } catch (RuntimeException e) {
            throw new CollaboratorException("Planning call failed: " + e.getMessage(), e);
        }
        if (runPlan == null) {
            throw new CollaboratorException("Planning call returned no plan");
        }
        PlanResult result = runPlan.toPlanResult();
        log.info("Plan: backend={}, frontend={}, {} endpoint(s) - {}", result.needsBackend(),
                result.needsFrontend(), result.contract().endpoints().size(), result.summary());
        return result;
    }

    @Override
    public JudgmentResult judge(Contract contract, Map<Target, ArtifactSet> artifactsByTarget) {
        String userPrompt = buildJudgePrompt(contract, artifactsByTarget);
        JudgeResponse response;
        try {
            response = llmService.structuredCall(JUDGE_SYSTEM_PROMPT, userPrompt, JudgeResponse.class);
        } catch (RuntimeException e) {
            throw new CollaboratorException("Judgment call failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new CollaboratorException("Judgment call returned no verdict");
        }
        JudgmentResult result = response.toJudgmentResult();
        log.info("Judgment: compatible={}, {} issue(s)", result.compatible(), result.issues().size());
        return result;
    }

    String buildPlanPrompt(String goal, List<String> feedback) {
        var sb = new StringBuilder();
        sb.append("=== GOAL ===\n").append(goal).append("\n");
        if (feedback != null && !feedback.isEmpty()) {
            sb.append("\n=== FEEDBACK FROM THE PREVIOUS ITERATION ===\n");
            sb.append("The previous attempt was rejected. Revise the plan and contract to fix these points:\n");
            feedback.forEach(line -> sb.append("- ").append(line).append("\n"));
        }
        return sb.toString();
    }

    String buildJudgePrompt(Contract contract, Map<Target, ArtifactSet> artifactsByTarget) {
        var sb = new StringBuilder();
        sb.append("=== API CONTRACT ===\n").append(toJson(contract)).append("\n");
        for (Target target : Target.values()) {
            ArtifactSet artifacts = artifactsByTarget.get(target);
            if (artifacts == null) {
                continue;
            }
            sb.append("\n=== ").append(target.name()).append(" CODE (samples) ===\n");
            artifacts.files().forEach((path, content) ->
                    sb.append("--- ").append(path).append(" ---\n").append(sample(content)).append("\n"));
        }
        return sb.toString();
    }

    static String sample(String content) {
        if (content == null) {
            return "";
        }
        return content.lines().limit(SAMPLE_LINES).collect(Collectors.joining("\n"));
    }

    private String toJson(Contract contract) {
        try {
            return mapper.writeValueAsString(contract);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize contract: {}", e.getMessage());
            return contract.endpoints().toString();
        }
    }
}
