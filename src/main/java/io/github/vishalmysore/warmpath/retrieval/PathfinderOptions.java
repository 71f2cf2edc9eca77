package io.github.vishalmysore.warmpath.retrieval;

import lombok.Builder;
import lombok.Value;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Per-call settings of the pathfinder. Defaults can be overridden from a
 * {@code warmpath.properties} file on the classpath.
 */
@Value
@Builder(toBuilder = true)
public class PathfinderOptions {
    private static final Logger log = Logger.getLogger(PathfinderOptions.class.getName());

    public static final String RESOURCE = "warmpath.properties";

    public static final int MIN_HOPS = 1;
    public static final int MAX_HOPS = 10;
    public static final int MIN_RESULTS = 1;
    public static final int MAX_RESULTS = 20;

    @Builder.Default
    int maxHops = 3;

    @Builder.Default
    int maxResults = 5;

    @Builder.Default
    double minStrength = 0.3;

    // Budget of partial paths to expand, 0 for none
    @Builder.Default
    int maxExpansions = 0;

    // Wall-clock budget per search, null for none
    Duration timeout;

    public static PathfinderOptions defaults() {
        return PathfinderOptions.builder().build();
    }

    /**
     * Reads {@value #RESOURCE} from the classpath; missing file or keys fall
     * back to the built-in defaults.
     */
    public static PathfinderOptions loadDefaults() {
        Properties props = new Properties();
        try (InputStream is = PathfinderOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null) {
                props.load(is);
            } else {
                log.info(RESOURCE + " not found, using built-in pathfinder defaults");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
        return fromProperties(props);
    }

    public static PathfinderOptions fromProperties(Properties props) {
        PathfinderOptions defaults = defaults();
        long timeoutMillis = Long.parseLong(props.getProperty("pathfinder.timeoutMillis", "0").trim());
        PathfinderOptions options = PathfinderOptions.builder()
                .maxHops(intProperty(props, "pathfinder.maxHops", defaults.getMaxHops()))
                .maxResults(intProperty(props, "pathfinder.maxResults", defaults.getMaxResults()))
                .minStrength(Double.parseDouble(props.getProperty("pathfinder.minStrength",
                        String.valueOf(defaults.getMinStrength())).trim()))
                .maxExpansions(intProperty(props, "pathfinder.maxExpansions", defaults.getMaxExpansions()))
                .timeout(timeoutMillis > 0 ? Duration.ofMillis(timeoutMillis) : null)
                .build();
        return options.validate();
    }

    /**
     * Checks the bounds the API layer also enforces.
     *
     * @return this, for chaining
     */
    public PathfinderOptions validate() {
        if (maxHops < MIN_HOPS || maxHops > MAX_HOPS)
            throw new IllegalArgumentException("maxHops must be between " + MIN_HOPS + " and " + MAX_HOPS + ", got " + maxHops);
        if (maxResults < MIN_RESULTS || maxResults > MAX_RESULTS)
            throw new IllegalArgumentException("maxResults must be between " + MIN_RESULTS + " and " + MAX_RESULTS
                    + ", got " + maxResults);
        if (Double.isNaN(minStrength) || minStrength < 0.0 || minStrength > 1.0)
            throw new IllegalArgumentException("minStrength must be within [0,1], got " + minStrength);
        if (maxExpansions < 0)
            throw new IllegalArgumentException("maxExpansions must be non-negative, got " + maxExpansions);
        if (timeout != null && (timeout.isNegative() || timeout.isZero()))
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        return this;
    }

    private static int intProperty(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        return value == null ? fallback : Integer.parseInt(value.trim());
    }
}
