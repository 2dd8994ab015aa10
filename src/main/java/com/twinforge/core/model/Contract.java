package com.twinforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured description of how the generated targets must interoperate.
 */
public record Contract(
    String baseUrl,
    List<Endpoint> endpoints,
    List<DataModel> dataModels,
    FrontendSpec frontend,
    Integration integration
) implements Serializable {

    public Contract {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:8080" : baseUrl;
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        dataModels = dataModels == null ? List.of() : List.copyOf(dataModels);
        frontend = frontend == null ? FrontendSpec.none() : frontend;
        integration = integration == null ? Integration.none() : integration;
    }

    public static Contract empty() {
        return new Contract(null, List.of(), List.of(), null, null);
    }

    /**
     * Returns the portion of the contract that the given target is responsible for.
     * The backend implements every endpoint; the frontend calls the endpoints it lists,
     * or all of them when it lists none.
     */
    public ContractSlice sliceFor(Target target) {
        return switch (target) {
            case BACKEND -> new ContractSlice(target, baseUrl, endpoints, dataModels, null, integration);
            case FRONTEND -> new ContractSlice(target, baseUrl, frontendEndpoints(), dataModels, frontend, integration);
        };
    }

    /**
     * Endpoints the frontend is expected to call.
     */
    public List<Endpoint> frontendEndpoints() {
        if (frontend.apiCalls().isEmpty()) {
            return endpoints;
        }
        return endpoints.stream()
                .filter(e -> frontend.apiCalls().stream().anyMatch(call -> matchesCall(e, call)))
                .toList();
    }

    private static boolean matchesCall(Endpoint endpoint, String call) {
        String normalized = call.trim().replaceAll("\\s+", " ");
        if (normalized.equalsIgnoreCase(endpoint.signature())) {
            return true;
        }
        return normalized.equals(endpoint.path());
    }
}
