package com.twinforge.core.model;

import java.io.Serializable;
import java.util.List;

public record Integration(List<String> corsOrigins, String authMethod) implements Serializable {

    public Integration {
        corsOrigins = corsOrigins == null ? List.of() : List.copyOf(corsOrigins);
        authMethod = authMethod == null || authMethod.isBlank() ? "none" : authMethod;
    }

    public static Integration none() {
        return new Integration(List.of(), "none");
    }
}
