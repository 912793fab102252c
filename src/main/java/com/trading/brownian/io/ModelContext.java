package com.trading.brownian.io;

import java.util.Map;
import java.util.Set;

import com.trading.brownian.interp.StreamingInterpolator;
import com.trading.brownian.process.BrownianProcess;

/**
 * The live objects built from a {@link ModelDefinition}, looked up by name.
 *
 * The context itself is immutable. The processes and interpolators it hands out
 * are mutable and single-threaded.
 */
public final class ModelContext {
    private final String name;
    private final Map<String, BrownianProcess> processes;
    private final Map<String, StreamingInterpolator> interpolators;

    public ModelContext(String name, Map<String, BrownianProcess> processes,
            Map<String, StreamingInterpolator> interpolators) {
        this.name = name;
        this.processes = Map.copyOf(processes);
        this.interpolators = Map.copyOf(interpolators);
    }

    public String name() {
        return name;
    }

    /**
     * @throws IllegalArgumentException if no process has that name.
     */
    public BrownianProcess process(String name) {
        BrownianProcess p = processes.get(name);
        if (p == null)
            throw new IllegalArgumentException("Unknown process: " + name);
        return p;
    }

    /**
     * @throws IllegalArgumentException if no interpolator has that name.
     */
    public StreamingInterpolator interpolator(String name) {
        StreamingInterpolator i = interpolators.get(name);
        if (i == null)
            throw new IllegalArgumentException("Unknown interpolator: " + name);
        return i;
    }

    public Set<String> processNames() {
        return processes.keySet();
    }

    public Set<String> interpolatorNames() {
        return interpolators.keySet();
    }
}
