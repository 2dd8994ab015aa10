package com.twinforge.core.model;

/**
 * An independently generated component of the application.
 */
public enum Target {
    BACKEND,
    FRONTEND;

    public String wireName() {
        return name().toLowerCase();
    }
}
