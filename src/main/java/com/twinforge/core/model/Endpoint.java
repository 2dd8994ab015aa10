package com.twinforge.core.model;

import java.io.Serializable;

/**
 * One interface operation of the contract.
 */
public record Endpoint(
    String method,
    String path,
    String description,
    String requestShape,
    String responseShape
) implements Serializable {

    public Endpoint {
        method = method == null ? "GET" : method.trim().toUpperCase();
        path = path == null ? "" : path.trim();
    }

    /** e.g. {@code GET /api/todos} */
    public String signature() {
        return method + " " + path;
    }
}
