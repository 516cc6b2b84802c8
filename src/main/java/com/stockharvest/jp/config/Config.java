package com.stockharvest.jp.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Layered screener settings: built-in defaults, then {@code config.properties} on the classpath,
 * then a {@code config.properties} in the working directory.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);
    private static final String FILE_NAME = "config.properties";
    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("classpath {} unreadable, using defaults: {}", FILE_NAME, e.getMessage());
        }

        if (workingDir != null) {
            Path local = workingDir.resolve(FILE_NAME);
            if (Files.exists(local)) {
                try (InputStream in = Files.newInputStream(local)) {
                    config.overrideProps.load(in);
                    config.props.putAll(config.overrideProps);
                } catch (IOException e) {
                    LOG.warn("failed to read {}: {}", local, e.getMessage());
                }
            }
        }
        return config;
    }

    /**
     * Defaults plus the given overrides, without touching the classpath or the file system.
     */
    public static Config of(Map<String, String> overrides) {
        Config config = new Config(Path.of("."));
        if (overrides != null) {
            for (Map.Entry<String, String> entry : overrides.entrySet()) {
                if (entry.getKey() == null || entry.getKey().trim().isEmpty()) {
                    continue;
                }
                String value = entry.getValue() == null ? "" : entry.getValue();
                config.overrideProps.setProperty(entry.getKey().trim(), value);
                config.props.setProperty(entry.getKey().trim(), value);
            }
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        return value.isEmpty() ? fallback : value;
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key) {
        return getLong(key, (long) parseDouble(DEFAULTS.get(key), 0.0));
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            double asDouble = parseDouble(value, Double.NaN);
            return Double.isFinite(asDouble) ? (long) asDouble : fallback;
        }
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    /**
     * Resolves a path setting against the working directory; null when the setting is blank.
     */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return null;
        }
        Path base = workingDir == null ? Path.of(".") : workingDir;
        return base.resolve(value).normalize();
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private static String nonBlank(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new LinkedHashMap<>();

        defaults.put("patternA.min_change_rate", "15");
        defaults.put("patternA.stop_high_proximity", "0.98");
        defaults.put("patternA.min_volume", "20000000");
        defaults.put("patternA.max_lower_shadow_ratio", "0.15");
        defaults.put("patternA.entry_trigger_pct", "5");
        defaults.put("patternA.profit_target_pct", "24");
        defaults.put("patternA.stop_loss_pct", "10");
        defaults.put("patternA.strength_full_scale_pct", "30");
        defaults.put("patternA.unexplained_spike_pct", "20");
        defaults.put("patternA.max_listing_years", "2.5");
        defaults.put("patternA.max_holding_days", "30");
        defaults.put("patternA.consecutive_window_days", "3");
        defaults.put("patternA.consecutive_limit", "2");

        defaults.put("patternB.ma5_crossover_threshold", "0.02");
        defaults.put("patternB.min_loss_quarters", "2");
        defaults.put("patternB.profit_target_pct", "25");
        defaults.put("patternB.stop_loss_pct", "10");
        defaults.put("patternB.max_holding_days", "45");
        defaults.put("patternB.liquidity_floor", "5000000");
        defaults.put("patternB.max_abs_change_rate", "15");
        defaults.put("patternB.entry_min_change_rate", "1");
        defaults.put("patternB.entry_max_change_rate", "8");
        defaults.put("patternB.tax_loss.cumulative_threshold", "1000000000");
        defaults.put("patternB.tax_loss.quarter_threshold", "6");
        defaults.put("patternB.dedup_months", "6");

        defaults.put("signal.max_risk_per_trade", "0.02");
        defaults.put("signal.min_risk_reward", "1.5");
        defaults.put("signal.max_portfolio_exposure", "0.10");
        defaults.put("signal.portfolio_size", "10000000");
        defaults.put("signal.lot_size", "100");
        defaults.put("signal.profit_target_rate", "0.24");
        defaults.put("signal.stop_loss_rate", "0.10");
        defaults.put("signal.entry_spread_rate", "0.001");

        defaults.put("scan.concurrency", "5");
        defaults.put("history.capacity", "50");
        defaults.put("history.path", "");

        return Collections.unmodifiableMap(defaults);
    }
}
