package org.dice.logic.config;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Engine tuning read from {@value #RESOURCE} on the classpath, overridden by system properties
 * of the same name. Invalid values are logged and replaced by their defaults.
 */
public class EngineSettings {

    private static final Logger log = LoggerFactory.getLogger(EngineSettings.class);

    public static final String RESOURCE = "logic-engine.properties";

    public static final String MAX_VARIABLES = "truthtable.max.variables";
    public static final String PARALLEL = "truthtable.parallel";

    public static final int DEFAULT_MAX_VARIABLES = 20;
    // 2^24 rows is the most a table is allowed to hold
    public static final int MAX_VARIABLES_LIMIT = 24;
    public static final boolean DEFAULT_PARALLEL = false;

    private final int maxVariables;
    private final boolean parallel;

    public EngineSettings(int maxVariables, boolean parallel) {
        if (maxVariables < 0 || maxVariables > MAX_VARIABLES_LIMIT) {
            throw new IllegalArgumentException(String.format("%s must be between 0 and %d, got %d",
                    MAX_VARIABLES, MAX_VARIABLES_LIMIT, maxVariables));
        }
        this.maxVariables = maxVariables;
        this.parallel = parallel;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_MAX_VARIABLES, DEFAULT_PARALLEL);
    }

    /**
     * Loads the classpath resource, if any, then applies system property overrides.
     */
    public static EngineSettings load() {
        Properties props = new Properties();
        InputStream in = EngineSettings.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in != null) {
            try {
                props.load(in);
            } catch (IOException e) {
                log.error(String.format("Failed to read %s. Using defaults", RESOURCE), e);
                props.clear();
            } finally {
                IOUtils.closeQuietly(in);
            }
        }
        for (String key : new String[]{MAX_VARIABLES, PARALLEL}) {
            String override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    public static EngineSettings fromProperties(Properties props) {
        return new EngineSettings(readMaxVariables(props.getProperty(MAX_VARIABLES)),
                readParallel(props.getProperty(PARALLEL)));
    }

    public int getMaxVariables() {
        return maxVariables;
    }

    public boolean isParallel() {
        return parallel;
    }

    private static int readMaxVariables(String value) {
        if (StringUtils.isBlank(value)) {
            return DEFAULT_MAX_VARIABLES;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            parsed = -1;
        }
        if (parsed >= 0 && parsed <= MAX_VARIABLES_LIMIT) {
            return parsed;
        }
        log.error(String.format("Invalid %s: %s. Defaulting to %d", MAX_VARIABLES, value, DEFAULT_MAX_VARIABLES));
        return DEFAULT_MAX_VARIABLES;
    }

    private static boolean readParallel(String value) {
        if (StringUtils.isBlank(value)) {
            return DEFAULT_PARALLEL;
        }
        String normalized = value.trim().toLowerCase();
        if (normalized.equals("true") || normalized.equals("false")) {
            return Boolean.parseBoolean(normalized);
        }
        log.error(String.format("Invalid %s: %s. Defaulting to %s", PARALLEL, value, DEFAULT_PARALLEL));
        return DEFAULT_PARALLEL;
    }

    @Override
    public String toString() {
        return String.format("EngineSettings{%s=%d, %s=%s}", MAX_VARIABLES, maxVariables, PARALLEL, parallel);
    }
}
