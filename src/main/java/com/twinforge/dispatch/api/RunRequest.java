package com.twinforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/runs.
 *
 * @param goal                     natural-language goal
 * @param maxIterations            top-level iteration budget; nullable, defaults to configuration
 * @param backendMaxSubIterations  backend sub-iteration budget; nullable
 * @param frontendMaxSubIterations frontend sub-iteration budget; nullable
 * @param parallel                 false selects sequential target execution; nullable
 */
public record RunRequest(
    String goal,
    @JsonProperty("max_iterations") Integer maxIterations,
    @JsonProperty("backend_max_sub_iterations") Integer backendMaxSubIterations,
    @JsonProperty("frontend_max_sub_iterations") Integer frontendMaxSubIterations,
    Boolean parallel
) {}
