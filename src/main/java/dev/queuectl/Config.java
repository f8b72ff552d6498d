package dev.queuectl;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Set;

public class Config {
    public static final String MAX_RETRIES = "max-retries";
    public static final String BACKOFF_BASE = "backoff-base";
    public static final String DEFAULT_TIMEOUT = "default-timeout";
    public static final String DEFAULT_PRIORITY = "default-priority";

    public static final Set<String> KEYS = Set.of(MAX_RETRIES, BACKOFF_BASE, DEFAULT_TIMEOUT, DEFAULT_PRIORITY);

    public static final String DB_PROPERTY = "queuectl.db";
    public static final String DB_ENV = "QUEUECTL_DB";

    private final JobStore store;

    public Config(JobStore store) {
        this.store = store;
    }

    public int maxRetries() {
        return intValue(MAX_RETRIES);
    }

    public int backoffBase() {
        return intValue(BACKOFF_BASE);
    }

    public int defaultTimeout() {
        return intValue(DEFAULT_TIMEOUT);
    }

    public int defaultPriority() {
        return intValue(DEFAULT_PRIORITY);
    }

    public String get(String key) {
        String value = store.getConfig(key);
        return value != null ? value : JobStore.CONFIG_DEFAULTS.get(key);
    }

    public Map<String, String> all() {
        return store.configEntries();
    }

    /**
     * @throws IllegalArgumentException for unknown keys or values outside the key's range
     */
    public void set(String key, String value) {
        if (!KEYS.contains(key)) {
            throw new IllegalArgumentException("Unknown config key: " + key + " (known: " + String.join(", ", KEYS) + ")");
        }
        int v;
        try {
            v = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Value for " + key + " must be an integer: " + value);
        }
        int min = switch (key) {
            case BACKOFF_BASE, DEFAULT_TIMEOUT -> 1;
            case MAX_RETRIES -> 0;
            default -> Integer.MIN_VALUE;
        };
        if (v < min) throw new IllegalArgumentException("Value for " + key + " must be >= " + min);
        store.setConfig(key, Integer.toString(v));
    }

    private int intValue(String key) {
        String raw = get(key);
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return Integer.parseInt(JobStore.CONFIG_DEFAULTS.get(key));
        }
    }

    /**
     * Explicit path, then {@code -Dqueuectl.db}, then {@code $QUEUECTL_DB}, then {@code ~/.queuectl/data/queuectl.db}.
     */
    public static Path resolveDbPath(String explicit) {
        if (explicit != null && !explicit.isBlank()) return Paths.get(explicit);
        String prop = System.getProperty(DB_PROPERTY);
        if (prop != null && !prop.isBlank()) return Paths.get(prop);
        String env = System.getenv(DB_ENV);
        if (env != null && !env.isBlank()) return Paths.get(env);
        return Paths.get(System.getProperty("user.home"), ".queuectl", "data", "queuectl.db");
    }
}
