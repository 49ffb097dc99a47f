package com.fujical.engine.config;

import java.lang.reflect.Array;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Engine configuration over built-in defaults. Bound values come from the Spring environment,
 * where the working-directory config.properties takes precedence over the classpath copy.
 * Typed getters fall back to the default on blank or unparsable values.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    /**
     * Build Config from Spring-bound configuration properties.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    /**
     * As {@link #fromConfigurationProperties(Path, Map)}, then applies {@code fallbacks} to keys
     * the bound properties left unset.
     */
    public static Config fromConfigurationProperties(
            Path workingDir,
            Map<String, ?> rawProperties,
            Map<String, String> fallbacks
    ) {
        Config config = fromConfigurationProperties(workingDir, rawProperties);
        if (fallbacks != null) {
            for (Map.Entry<String, String> e : fallbacks.entrySet()) {
                if (config.props.getProperty(e.getKey()) == null) {
                    putBoundValue(config, e.getKey(), e.getValue());
                }
            }
        }
        return config;
    }

    /**
     * Defaults plus the given overrides; used by embedders and tests.
     */
    public static Config of(Map<String, String> overrides) {
        Config config = new Config(Path.of(".").toAbsolutePath().normalize());
        if (overrides != null) {
            for (Map.Entry<String, String> e : overrides.entrySet()) {
                putBoundValue(config, e.getKey(), e.getValue());
            }
        }
        return config;
    }

    public static Config defaultsOnly() {
        return of(Map.of());
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
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        return parseInt(value, fallback);
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        String value = getString(key);
        return parseDouble(value, fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public ZoneId zone() {
        try {
            return ZoneId.of(getString("app.zone", "Asia/Tokyo"));
        } catch (Exception e) {
            System.err.println("WARN: invalid app.zone, using Asia/Tokyo: " + e.getMessage());
            return ZoneId.of("Asia/Tokyo");
        }
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (config == null || key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("app.zone", "Asia/Tokyo");
        defaults.put("outputs.dir", "outputs");
        defaults.put("db.url", "jdbc:postgresql://localhost:5432/fujical");
        defaults.put("db.user", "fujical");
        defaults.put("db.pass", "fujical");
        defaults.put("db.schema", "fujical");
        defaults.put("db.sql_log.enabled", "false");

        defaults.put("fuji.latitude", "35.3628");
        defaults.put("fuji.longitude", "138.730781");
        defaults.put("fuji.elevation_m", "3776");
        defaults.put("fuji.summit_width_m", "800");

        defaults.put("stage1.reference.latitude", "35.3628");
        defaults.put("stage1.reference.longitude", "138.730781");
        defaults.put("stage1.reference.elevation_m", "3776");
        defaults.put("stage1.interval_minutes", "5");
        defaults.put("stage1.chunk_days", "14");
        defaults.put("stage1.batch_size", "1000");
        defaults.put("stage1.threads", "4");
        defaults.put("stage1.sun.visible_min_elevation", "-6.0");
        defaults.put("stage1.moon.visible_min_elevation", "-2.0");
        defaults.put("stage1.resume_enabled", "true");
        defaults.put("stage1.checkpoint_key", "stage1.orbit.checkpoint.v1");
        defaults.put("stage1.progress.log_every", "30");

        defaults.put("stage2.rising.azimuth_center", "95.0");
        defaults.put("stage2.rising.azimuth_half_width", "35.0");
        defaults.put("stage2.setting.azimuth_center", "265.0");
        defaults.put("stage2.setting.azimuth_half_width", "30.0");
        defaults.put("stage2.elevation_min", "-10.0");
        defaults.put("stage2.elevation_max", "90.0");
        defaults.put("stage2.sun.morning_start_hour", "4");
        defaults.put("stage2.sun.morning_end_hour", "9");
        defaults.put("stage2.sun.afternoon_start_hour", "14");
        defaults.put("stage2.sun.afternoon_end_hour", "19");
        defaults.put("stage2.moon.min_illumination", "0.70");
        defaults.put("stage2.batch_size", "1000");

        defaults.put("stage3.source", "STAGE1");
        defaults.put("stage3.threads", "4");
        defaults.put("stage3.batch_size", "1000");
        defaults.put("stage3.max_distance_km", "300");
        defaults.put("stage3.diamond.elevation_band", "2.0");
        defaults.put("stage3.pearl.azimuth_tolerance", "2.0");
        defaults.put("stage3.pearl.elevation_tolerance", "2.0");
        defaults.put("stage3.moon.min_illumination", "0.70");
        defaults.put("stage3.max_total_diff", "2.5");
        defaults.put("stage3.dedup.quality_margin", "0.1");
        defaults.put("stage3.dedup.min_separation_minutes", "120");
        defaults.put("stage3.dedup.max_events_per_day", "2");
        defaults.put("stage3.progress.log_every", "20");

        defaults.put("quality.base", "0.7");
        defaults.put("quality.distance_penalty_start_km", "150");
        defaults.put("quality.distance_penalty_span_km", "200");
        defaults.put("quality.distance_penalty_floor", "0.8");

        defaults.put("search.coarse_step_seconds", "30");
        defaults.put("search.setting.coarse_step_seconds", "20");
        defaults.put("search.fine_step_seconds", "10");
        defaults.put("search.setting.fine_step_seconds", "5");
        defaults.put("search.fine_span_minutes", "2");
        defaults.put("search.escalation_threshold", "3.0");
        defaults.put("search.diamond.azimuth_tolerance.close", "0.25");
        defaults.put("search.diamond.azimuth_tolerance.medium", "0.4");
        defaults.put("search.diamond.azimuth_tolerance.far", "0.6");
        defaults.put("search.pearl.azimuth_tolerance.close", "1.0");
        defaults.put("search.pearl.azimuth_tolerance.medium", "2.0");
        defaults.put("search.pearl.azimuth_tolerance.far", "3.0");
        defaults.put("search.close_distance_km", "50");
        defaults.put("search.medium_distance_km", "100");
        defaults.put("search.diamond.elevation_tolerance", "0.25");
        defaults.put("search.pearl.elevation_tolerance", "4.0");
        defaults.put("search.pearl.min_illumination", "0.1");

        defaults.put("health.stage1_ok_ratio", "0.95");
        defaults.put("health.location_coverage_threshold", "0.5");
        return defaults;
    }
}
