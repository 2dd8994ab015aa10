package com.twinforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * The part of the {@link Contract} a single target works against.
 *
 * @param frontend frontend spec; null for the backend slice
 */
public record ContractSlice(
    Target target,
    String baseUrl,
    List<Endpoint> endpoints,
    List<DataModel> dataModels,
    FrontendSpec frontend,
    Integration integration
) implements Serializable {

    public ContractSlice {
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        dataModels = dataModels == null ? List.of() : List.copyOf(dataModels);
    }
}
