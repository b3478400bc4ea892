package me.christianrobert.polyglotconv.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Converter settings, held in memory.
 *
 * <p>Starts from built-in defaults; entries can be replaced one by one, in bulk, or from
 * {@code polyglotconv.}-prefixed properties (e.g. {@code -Dpolyglotconv.java.opaque-type=var}).</p>
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String PROPERTY_PREFIX = "polyglotconv.";

    public static final String REQL_ROOT_NAME = "convert.reql-root-name";
    public static final String TEST_EXCLUSIONS = "convert.test-exclusions";
    public static final String REQL_TERM_TYPE = "java.reql-term-type";
    public static final String OPAQUE_TYPE = "java.opaque-type";

    private static final Map<String, String> DEFAULTS;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(REQL_ROOT_NAME, "r");
        // These hang or exercise driver features the Java driver lacks
        defaults.put(TEST_EXCLUSIONS, "regression/1133,regression/767,regression/1005,changefeeds/squash,arity");
        defaults.put(REQL_TERM_TYPE, "ReqlAst");
        defaults.put(OPAQUE_TYPE, "Object");
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, String> settings = new ConcurrentHashMap<>();

    public ConfigService() {
        settings.putAll(DEFAULTS);
        log.debug("Converter settings initialized with {} defaults", DEFAULTS.size());
    }

    /**
     * Snapshot of all current settings.
     */
    public Map<String, String> getSettings() {
        return new LinkedHashMap<>(settings);
    }

    public String getString(String key) {
        return settings.get(key);
    }

    /**
     * Splits a comma separated setting ({@code "regression/1133, arity"}), trimming each entry
     * and dropping empty ones. Unknown keys yield an empty list.
     */
    public List<String> getStringList(String key) {
        String raw = settings.get(key);
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .collect(Collectors.toList());
    }

    // ========== Typed accessors ==========

    /**
     * Name of the ReQL root object; always part of the initial set of ReQL variables.
     */
    public String getReqlRootName() {
        return getString(REQL_ROOT_NAME);
    }

    /**
     * Test file name fragments excluded from a batch run.
     */
    public List<String> getTestExclusions() {
        return getStringList(TEST_EXCLUSIONS);
    }

    /**
     * Java type used to declare variables holding ReQL terms.
     */
    public String getReqlTermType() {
        return getString(REQL_TERM_TYPE);
    }

    /**
     * Java type used to declare variables holding any other value.
     */
    public String getOpaqueType() {
        return getString(OPAQUE_TYPE);
    }

    // ========== Updates ==========

    /**
     * Replaces one setting.
     *
     * @throws IllegalArgumentException if the value is null
     */
    public void set(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Setting " + key + " cannot be null");
        }
        String previous = settings.put(key, value);
        log.debug("Setting {} = {} (was: {})", key, value, previous);
    }

    public void setAll(Map<String, String> values) {
        values.forEach(this::set);
        log.info("Updated {} converter settings", values.size());
    }

    /**
     * Applies every {@code polyglotconv.<key>} property, e.g. from {@link System#getProperties()}.
     *
     * @return Number of settings overridden
     */
    public int applyOverrides(Properties properties) {
        int applied = 0;
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(PROPERTY_PREFIX)) {
                set(name.substring(PROPERTY_PREFIX.length()), properties.getProperty(name));
                applied++;
            }
        }
        if (applied > 0) {
            log.info("Applied {} converter setting overrides", applied);
        }
        return applied;
    }

    public boolean isSet(String key) {
        return settings.containsKey(key);
    }

    public void resetToDefaults() {
        settings.clear();
        settings.putAll(DEFAULTS);
        log.info("Converter settings reset to defaults");
    }
}
