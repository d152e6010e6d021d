package com.agentrelay.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the dashboard configuration.
 * <p>
 * Resolution order: JSON file (with {@code ${VAR}} / {@code ${VAR:-default}}
 * substitution), then environment overrides ({@code PORT}, {@code RELAY_URL},
 * {@code MOCK}, {@code VERBOSE}), then defaults for anything still missing.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, DashboardConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env != null ? env : Map.of();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public DashboardConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public DashboardConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private DashboardConfig doLoadConfig() {
        DashboardConfig config;
        try {
            if (!Files.exists(configPath)) {
                log.info("Config file not found: {}, using defaults", configPath);
                config = new DashboardConfig();
            } else {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, DashboardConfig.class);
                if (config == null) {
                    config = new DashboardConfig();
                }
                log.info("Config loaded from: {}", configPath);
            }
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            config = new DashboardConfig();
        }
        applyEnvOverrides(config);
        return ConfigDefaults.apply(config);
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    void applyEnvOverrides(DashboardConfig config) {
        String relayUrl = trimToNull(env.get("RELAY_URL"));
        if (relayUrl != null) {
            config.setRelayUrl(relayUrl);
        }
        String mock = trimToNull(env.get("MOCK"));
        if (mock != null) {
            config.setMock("true".equalsIgnoreCase(mock));
        }
        String verbose = trimToNull(env.get("VERBOSE"));
        if (verbose != null) {
            config.setVerbose("true".equalsIgnoreCase(verbose));
        }
        String port = trimToNull(env.get("PORT"));
        if (port != null) {
            try {
                config.setPort(Integer.parseInt(port));
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid PORT value: {}", port);
            }
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }
}
