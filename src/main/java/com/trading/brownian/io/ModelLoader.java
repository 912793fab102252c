package com.trading.brownian.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.brownian.interp.InterpolatorType;
import com.trading.brownian.interp.StreamingInterpolator;
import com.trading.brownian.process.BrownianHistory;
import com.trading.brownian.process.BrownianProcess;
import com.trading.brownian.process.InvalidParameterException;

import lombok.extern.log4j.Log4j2;

/**
 * Reads JSON model definitions and compiles them into a {@link ModelContext}.
 *
 * <p>
 * Example:
 *
 * <pre>
 * {
 *   "model": {
 *     "name": "rates",
 *     "processes": [
 *       { "name": "short_rate", "sigma": 0.2, "drift": 0.01, "startVal": 1.5, "seed": 42 }
 *     ],
 *     "interpolators": [
 *       { "name": "curve", "type": "LINEAR", "observations": [[0, 0], [10, 100]] }
 *     ]
 *   }
 * }
 * </pre>
 */
@Log4j2
public final class ModelLoader {
    private final ObjectMapper mapper;

    public ModelLoader() {
        this(new ObjectMapper());
    }

    public ModelLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Parses a JSON string into a ModelDefinition. */
    public ModelDefinition parse(String json) {
        try {
            return mapper.readValue(json, ModelDefinition.class);
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    /** Parses a JSON file into a ModelDefinition. */
    public ModelDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a classpath resource into a ModelDefinition. */
    public ModelDefinition parseResource(String resource) throws IOException {
        try (InputStream in = ModelLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return mapper.readValue(in, ModelDefinition.class);
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    /** Parses and compiles a JSON file. */
    public ModelContext load(Path path) throws IOException {
        return compile(parseFile(path));
    }

    /**
     * Builds the processes and interpolators described by {@code def}.
     *
     * @throws InvalidParameterException on missing names or sigma, duplicate
     *                                   names, unknown shared histories, bad
     *                                   observation pairs or invalid process
     *                                   parameters.
     * @throws IllegalArgumentException  on unknown interpolator types.
     */
    public ModelContext compile(ModelDefinition def) {
        ModelDefinition.ModelInfo info = def == null ? null : def.getModel();
        if (info == null)
            throw new InvalidParameterException("Missing 'model' key");

        Set<String> names = new HashSet<>();
        Map<String, BrownianProcess> processes = new HashMap<>();
        Map<String, StreamingInterpolator> interpolators = new HashMap<>();

        if (info.getProcesses() != null) {
            for (ModelDefinition.ProcessDef pd : info.getProcesses()) {
                requireUniqueName(pd.getName(), names);
                processes.put(pd.getName(), buildProcess(pd, processes));
            }
        }

        if (info.getInterpolators() != null) {
            for (ModelDefinition.InterpolatorDef id : info.getInterpolators()) {
                requireUniqueName(id.getName(), names);
                StreamingInterpolator interpolator = InterpolatorType.fromString(id.getType()).create();
                for (double[] point : observations(id.getName(), id.getObservations())) {
                    interpolator.insert(point[0], point[1]);
                }
                interpolators.put(id.getName(), interpolator);
            }
        }

        log.info("Compiled model '{}': {} processes, {} interpolators",
                info.getName(), processes.size(), interpolators.size());
        return new ModelContext(info.getName(), processes, interpolators);
    }

    private BrownianProcess buildProcess(ModelDefinition.ProcessDef pd, Map<String, BrownianProcess> built) {
        if (pd.getSigma() == null)
            throw new InvalidParameterException("Process '" + pd.getName() + "' is missing 'sigma'");

        var builder = BrownianProcess.builder()
                .sigma(pd.getSigma())
                .startTime(pd.getStartTime())
                .startVal(pd.getStartVal())
                .drift(pd.getDrift());

        if (pd.getHistory() != null) {
            BrownianProcess owner = built.get(pd.getHistory());
            if (owner == null)
                throw new InvalidParameterException("Process '" + pd.getName()
                        + "' shares history of unknown or later process '" + pd.getHistory() + "'");
            builder.history(owner.getHistory());
        } else {
            builder.history(new BrownianHistory());
        }
        if (pd.getSeed() != null) {
            builder.seed(pd.getSeed());
        }

        BrownianProcess process = builder.build();
        for (double[] point : observations(pd.getName(), pd.getObservations())) {
            process.observe(point[0], point[1]);
        }
        return process;
    }

    private static List<double[]> observations(String owner, List<double[]> points) {
        if (points == null)
            return List.of();
        for (double[] point : points) {
            if (point == null || point.length != 2)
                throw new InvalidParameterException("'" + owner + "' has an observation that is not a [key, value] pair");
        }
        return points;
    }

    private static IllegalArgumentException malformed(JsonProcessingException e) {
        return new IllegalArgumentException("Malformed model definition: " + e.getOriginalMessage(), e);
    }

    private static void requireUniqueName(String name, Set<String> names) {
        if (name == null || name.isBlank())
            throw new InvalidParameterException("Every process and interpolator needs a name");
        if (!names.add(name))
            throw new InvalidParameterException("Duplicate name: " + name);
    }
}
