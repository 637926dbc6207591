package com.causal.cfpg.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of the options of a by-depth path search.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PathOptions {
    /** Deepest path length tried; null means the node count of the graph. */
    private Integer maxDepth;
    /** Paths drawn per non-empty length. */
    private int numSamples = 1000;
    /** Build cycle-free paths graphs; raw paths graphs otherwise. */
    private boolean cycleFree = true;
    private boolean signed;
    /** Required net sign in signed mode; null means 0. */
    private Integer targetPolarity = 0;
    /** Draw every path of a length with equal probability. */
    private boolean uniform;
    /** Seed of the sampling generator; null for an unseeded one. */
    private Long seed;

    public static PathOptions defaults() {
        return new PathOptions();
    }
}
