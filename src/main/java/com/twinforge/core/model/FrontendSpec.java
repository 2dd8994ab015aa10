package com.twinforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Frontend half of the contract.
 *
 * @param apiCalls endpoint signatures the frontend must call, e.g. {@code POST /api/todos}
 */
public record FrontendSpec(
    List<String> pages,
    List<String> components,
    List<String> apiCalls,
    String stateManagement
) implements Serializable {

    public FrontendSpec {
        pages = pages == null ? List.of() : List.copyOf(pages);
        components = components == null ? List.of() : List.copyOf(components);
        apiCalls = apiCalls == null ? List.of() : List.copyOf(apiCalls);
    }

    public static FrontendSpec none() {
        return new FrontendSpec(List.of(), List.of(), List.of(), "");
    }
}
