package com.trading.brownian.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a JSON model file: a set of named Brownian processes
 * and streaming interpolators.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ModelDefinition {
    private ModelInfo model;

    /** Meta-information and contents of the model. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ModelInfo {
        private String name;
        private List<ProcessDef> processes;
        private List<InterpolatorDef> interpolators;
    }

    /**
     * Definition of one Brownian process.
     * {@code history} names an earlier process whose history is shared.
     * {@code observations} are (time, value) pairs recorded after seeding.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ProcessDef {
        private String name;
        private Double sigma;
        private double startTime;
        private double startVal;
        private double drift;
        private Long seed;
        private String history;
        private List<double[]> observations;
    }

    /** Definition of one streaming interpolator with optional initial points. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class InterpolatorDef {
        private String name;
        private String type;
        private List<double[]> observations;
    }
}
