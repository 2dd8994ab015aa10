package com.twinforge.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable mapping of relative file path to file content produced by one generation call.
 */
public record ArtifactSet(Map<String, String> files) implements Serializable {

    public ArtifactSet {
        files = files == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public static ArtifactSet empty() {
        return new ArtifactSet(Map.of());
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int size() {
        return files.size();
    }

    public Set<String> paths() {
        return files.keySet();
    }

    /**
     * Returns a new set holding this set's files overlaid with {@code patch}.
     */
    public ArtifactSet overlay(ArtifactSet patch) {
        if (patch == null || patch.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<>(files);
        merged.putAll(patch.files());
        return new ArtifactSet(merged);
    }

    /**
     * All file contents joined, for text searches across the whole set.
     */
    public String joinedContent() {
        return String.join("\n", files.values());
    }
}
