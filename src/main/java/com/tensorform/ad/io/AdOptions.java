package com.tensorform.ad.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Tunables of a differentiation run.
 *
 * Loaded from JSON, for example the bundled {@code forward-ad.json}:
 *
 * <pre>{@code
 * { "maxDepth": 1000, "compoundRules": false,
 *   "warnMissingCoefficientDerivatives": true, "trace": false }
 * }</pre>
 *
 * Unknown keys are ignored; missing keys keep their defaults.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AdOptions {
    public static final String DEFAULT_RESOURCE = "forward-ad.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Maximum nesting depth of the recursive descent. Each level costs a few
     * stack frames, so the default stays well inside a default thread stack.
     */
    private int maxDepth = 1000;

    /** Differentiate compound tensor operators that commute with differentiation. */
    private boolean compoundRules;

    /** Warn when a coefficient has no entry in the partial-derivative table. */
    private boolean warnMissingCoefficientDerivatives = true;

    /** Log every rule application at debug level. */
    private boolean trace;

    public static AdOptions defaults() {
        return new AdOptions();
    }

    public static AdOptions fromJson(String json) {
        try {
            return validate(MAPPER.readValue(json, AdOptions.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid differentiation options: " + e.getOriginalMessage(), e);
        }
    }

    public static AdOptions load(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    /**
     * Loads options from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist.
     */
    public static AdOptions fromClasspath(String resource) {
        try (InputStream in = AdOptions.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Resource not found: " + resource);
            return validate(MAPPER.readValue(in, AdOptions.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    private static AdOptions validate(AdOptions options) {
        if (options.maxDepth <= 0)
            throw new IllegalArgumentException("maxDepth must be positive: " + options.maxDepth);
        return options;
    }
}
