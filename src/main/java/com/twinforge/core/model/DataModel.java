package com.twinforge.core.model;

import java.io.Serializable;
import java.util.Map;

public record DataModel(String name, Map<String, String> fields) implements Serializable {

    public DataModel {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }
}
