package com.twinforge.core.planning;

import com.twinforge.core.collaborator.PlanningCollaborator;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.Contract;
import com.twinforge.core.model.DataModel;
import com.twinforge.core.model.Endpoint;
import com.twinforge.core.model.FrontendSpec;
import com.twinforge.core.model.Integration;
import com.twinforge.core.model.JudgmentResult;
import com.twinforge.core.model.PlanResult;
import com.twinforge.core.model.Target;

import java.util.List;
import java.util.Map;

/**
 * Offline planning provider: always plans the same todo application and judges every
 * pair of artifact sets compatible.
 */
public class MockPlanningCollaborator implements PlanningCollaborator {

    static final Contract TODO_CONTRACT = new Contract(
            "http://localhost:8080",
            List.of(
                    new Endpoint("GET", "/api/todos", "List todos", null, "Todo[]"),
                    new Endpoint("POST", "/api/todos", "Create a todo", "{title}", "Todo"),
                    new Endpoint("DELETE", "/api/todos/{id}", "Delete a todo", null, "{}")),
            List.of(new DataModel("Todo", Map.of("id", "int", "title", "string", "done", "boolean"))),
            new FrontendSpec(List.of("TodoPage"), List.of("TodoList", "TodoForm"),
                    List.of("GET /api/todos", "POST /api/todos", "DELETE /api/todos/{id}"), "React useState"),
            new Integration(List.of("http://localhost:5173"), "none"));

    @Override
    public PlanResult plan(String goal, List<String> feedback) {
        String plan = """
                1. Backend: FastAPI service in main.py exposing the todo endpoints, requirements.txt
                2. Frontend: React app in src/App.jsx calling every endpoint, package.json
                """;
        String summary = feedback.isEmpty()
                ? "Todo application for: " + goal
                : "Revised todo application for: " + goal + " (" + feedback.size() + " feedback item(s))";
        return new PlanResult(summary, plan, TODO_CONTRACT, true, true);
    }

    @Override
    public JudgmentResult judge(Contract contract, Map<Target, ArtifactSet> artifactsByTarget) {
        return JudgmentResult.compatible("Mock judgment: targets assumed compatible");
    }
}
