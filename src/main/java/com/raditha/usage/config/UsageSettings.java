package com.raditha.usage.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.usage.policy.DiscardedNames;
import com.raditha.usage.policy.FieldExemptionPolicy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Loads usage analysis configuration from a YAML file (sweeper.yml) with
 * CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > sweeper.yml > defaults
 */
public class UsageSettings {

    public static final String DEFAULT_CONFIG_FILE = "sweeper.yml";
    static final String CONFIG_KEY = "usage_sweeper";

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private UsageSettings() {
        /* this is only a utility class */
    }

    /**
     * Read a configuration file.
     *
     * @param configFile the YAML file; a missing file yields an empty map
     * @return the top level YAML mapping
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static Map<String, Object> readYaml(Path configFile) throws IOException {
        if (configFile == null || !Files.exists(configFile)) {
            return Map.of();
        }
        Map<String, Object> root = yamlMapper.readValue(configFile.toFile(), new TypeReference<Map<String, Object>>() {
        });
        return root == null ? Map.of() : root;
    }

    /**
     * Build configuration from the YAML mapping, applying CLI overrides where provided.
     *
     * @param yaml           top level YAML mapping, may be empty
     * @param presetCLI      CLI preset name (null = use YAML/default)
     * @param parallelismCLI CLI worker count (0 = use YAML/default)
     * @return Complete usage configuration
     */
    public static UsageConfig loadConfig(Map<String, Object> yaml, String presetCLI, int parallelismCLI) {
        Map<String, Object> config = section(yaml);

        // Determine preset (CLI > YAML)
        String preset = presetCLI != null ? presetCLI : getString(config, "preset", null);
        UsageConfig base = preset != null ? forPreset(preset) : custom(config);

        int parallelism = parallelismCLI != 0 ? parallelismCLI : getInt(config, "parallelism", base.parallelism());
        return base.withParallelism(parallelism);
    }

    /**
     * Get the project base path from YAML configuration.
     *
     * @return the configured base path or null if not specified
     */
    public static String getBasePath(Map<String, Object> yaml) {
        return getString(section(yaml), "base_path", null);
    }

    static UsageConfig forPreset(String preset) {
        return switch (preset) {
            case "strict" -> UsageConfig.strict();
            case "lenient" -> UsageConfig.lenient();
            case "standard" -> UsageConfig.standard();
            default -> throw new IllegalArgumentException("Unknown preset: " + preset);
        };
    }

    private static UsageConfig custom(Map<String, Object> config) {
        UsageConfig defaults = UsageConfig.standard();

        List<String> excludePatterns = getListString(config, "exclude_patterns");
        if (excludePatterns.isEmpty()) {
            excludePatterns = defaults.excludePatterns();
        }

        List<String> preserved = getListString(config, "preserved_field_annotations");
        List<String> prefixes = getListString(config, "discarded_prefixes");
        List<String> names = getListString(config, "discarded_names");
        DiscardedNames discarded = new DiscardedNames(
                config.containsKey("discarded_prefixes") ? prefixes : defaults.discardedNames().prefixes(),
                config.containsKey("discarded_names") ? new HashSet<>(names) : defaults.discardedNames().names());

        return new UsageConfig(
                getBoolean(config, "include_tests", defaults.includeTests()),
                excludePatterns,
                getBoolean(config, "track_lambda_parameters", defaults.trackLambdaParameters()),
                getBoolean(config, "track_local_variables", defaults.trackLocalVariables()),
                config.containsKey("preserved_field_annotations")
                        ? new HashSet<>(preserved)
                        : FieldExemptionPolicy.DEFAULT_PRESERVED_ANNOTATIONS,
                discarded,
                defaults.parallelism());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> yaml) {
        Object raw = yaml == null ? null : yaml.get(CONFIG_KEY);
        if (raw instanceof Map) {
            return (Map<String, Object>) raw;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
