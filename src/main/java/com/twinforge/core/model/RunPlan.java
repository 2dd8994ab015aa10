package com.twinforge.core.model;

import java.util.List;
import java.util.Map;

/**
 * Structured output produced by the planning model.
 * Converted into a {@link PlanResult} before it enters run state.
 */
public record RunPlan(
    String summary,
    boolean needsBackend,
    boolean needsFrontend,
    String plan,
    ApiSpec apiSpec,
    FrontendSpec frontendSpec,
    Integration integration
) {

    public record ApiSpec(
        String baseUrl,
        List<EndpointSpec> endpoints,
        List<DataModelSpec> dataModels
    ) {}

    public record EndpointSpec(
        String method,
        String path,
        String description,
        String requestShape,
        String responseShape
    ) {}

    public record DataModelSpec(String name, Map<String, String> fields) {}

    public PlanResult toPlanResult() {
        List<Endpoint> endpoints = List.of();
        List<DataModel> models = List.of();
        String baseUrl = null;
        if (apiSpec != null) {
            baseUrl = apiSpec.baseUrl();
            if (apiSpec.endpoints() != null) {
                endpoints = apiSpec.endpoints().stream()
                        .filter(e -> e.path() != null && !e.path().isBlank())
                        .map(e -> new Endpoint(e.method(), e.path(), e.description(),
                                e.requestShape(), e.responseShape()))
                        .toList();
            }
            if (apiSpec.dataModels() != null) {
                models = apiSpec.dataModels().stream()
                        .map(m -> new DataModel(m.name(), m.fields()))
                        .toList();
            }
        }
        var contract = new Contract(baseUrl, endpoints, models, frontendSpec, integration);
        return new PlanResult(summary, plan, contract, needsBackend, needsFrontend);
    }
}
