package com.raditha.smells.config;

import com.raditha.smells.model.SmellKind;
import com.raditha.smells.report.ReportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the smell detector configuration from a YAML file and merges it with the
 * defaults.
 * <p>
 * Top-level keys are detector names ({@code LongMethod}, {@code GodClass}, ...)
 * mapping to snake_case options; {@code exclude_patterns} lists file globs and
 * {@code report.format} selects the report format. Missing keys keep their
 * defaults.
 *
 * <pre>
 * LongMethod:
 *   max_lines: 40
 * FeatureEnvy:
 *   enabled: false
 * report:
 *   format: txt
 * </pre>
 */
public class SmellDetectorSettings {

    private static final Logger logger = LoggerFactory.getLogger(SmellDetectorSettings.class);

    private static final String REPORT_KEY = "report";
    private static final String EXCLUDE_KEY = "exclude_patterns";
    private static final Set<String> IGNORED_KEYS = Set.of("language");

    private SmellDetectorSettings() {
        /* this is only a utility class */
    }

    /**
     * Load configuration from a YAML file. A missing file yields the defaults.
     *
     * @param configPath Path of the YAML file, may be null
     * @return Complete configuration
     * @throws IOException                   if the file exists but cannot be read
     * @throws InvalidConfigurationException if the file is malformed or holds
     *                                       invalid values
     */
    public static SmellConfig load(Path configPath) throws IOException {
        if (configPath == null || !Files.exists(configPath)) {
            if (configPath != null) {
                logger.info("Configuration file {} not found, using defaults", configPath);
            }
            return SmellConfig.defaults();
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            Object data = new Yaml().load(in);
            logger.debug("Loaded configuration from {}", configPath);
            return fromYamlObject(data, configPath.toString());
        } catch (YAMLException e) {
            throw new InvalidConfigurationException("Malformed configuration file " + configPath + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * Parse configuration from YAML text.
     */
    public static SmellConfig fromYaml(String yamlText) {
        try {
            return fromYamlObject(new Yaml().load(yamlText), "<inline>");
        } catch (YAMLException e) {
            throw new InvalidConfigurationException("Malformed configuration: " + e.getMessage(), e);
        }
    }

    private static SmellConfig fromYamlObject(Object data, String source) {
        if (data == null) {
            return SmellConfig.defaults();
        }
        if (!(data instanceof Map)) {
            throw new InvalidConfigurationException("Configuration " + source + " must be a map of detector names");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) data;
        return fromMap(config);
    }

    /**
     * Merge an already parsed configuration map over the defaults.
     */
    public static SmellConfig fromMap(Map<String, Object> config) {
        for (String key : config.keySet()) {
            if (SmellKind.fromName(key).isEmpty() && !REPORT_KEY.equals(key) && !EXCLUDE_KEY.equals(key)
                    && !IGNORED_KEYS.contains(key)) {
                logger.warn("Ignoring unknown configuration key '{}'", key);
            }
        }

        Map<String, Object> longMethod = section(config, SmellKind.LONG_METHOD.displayName());
        LongMethodOptions lm = LongMethodOptions.defaults();
        LongMethodOptions longMethodOptions = new LongMethodOptions(
                getBoolean(longMethod, "enabled", lm.enabled()),
                getInt(longMethod, "max_lines", lm.maxLines()),
                getInt(longMethod, "max_complexity", lm.maxComplexity()));

        Map<String, Object> godClass = section(config, SmellKind.GOD_CLASS.displayName());
        GodClassOptions gc = GodClassOptions.defaults();
        GodClassOptions godClassOptions = new GodClassOptions(
                getBoolean(godClass, "enabled", gc.enabled()),
                getInt(godClass, "max_fields", gc.maxFields()),
                getInt(godClass, "max_methods", gc.maxMethods()),
                getInt(godClass, "max_lines", gc.maxLines()));

        Map<String, Object> parameters = section(config, SmellKind.LARGE_PARAMETER_LIST.displayName());
        LargeParameterListOptions lp = LargeParameterListOptions.defaults();
        LargeParameterListOptions parameterOptions = new LargeParameterListOptions(
                getBoolean(parameters, "enabled", lp.enabled()),
                getInt(parameters, "max_parameters", lp.maxParameters()));

        Map<String, Object> magic = section(config, SmellKind.MAGIC_NUMBERS.displayName());
        MagicNumbersOptions mn = MagicNumbersOptions.defaults();
        MagicNumbersOptions magicOptions = new MagicNumbersOptions(
                getBoolean(magic, "enabled", mn.enabled()),
                getInt(magic, "min_occurrences", mn.minOccurrences()),
                getListDouble(magic, "whitelist", mn.whitelist()),
                getDouble(magic, "min_value", mn.minValue()),
                getDouble(magic, "max_value", mn.maxValue()));

        Map<String, Object> duplicates = section(config, SmellKind.DUPLICATED_CODE.displayName());
        DuplicatedCodeOptions dc = DuplicatedCodeOptions.defaults();
        DuplicatedCodeOptions duplicateOptions = new DuplicatedCodeOptions(
                getBoolean(duplicates, "enabled", dc.enabled()),
                getDouble(duplicates, "min_similarity", dc.minSimilarity()),
                getInt(duplicates, "min_chunk_size", dc.minChunkSize()));

        Map<String, Object> envy = section(config, SmellKind.FEATURE_ENVY.displayName());
        FeatureEnvyOptions fe = FeatureEnvyOptions.defaults();
        FeatureEnvyOptions envyOptions = new FeatureEnvyOptions(
                getBoolean(envy, "enabled", fe.enabled()),
                getInt(envy, "min_foreign_accesses", fe.minForeignAccesses()),
                getDouble(envy, "foreign_access_ratio", fe.foreignAccessRatio()));

        List<String> excludePatterns = getListString(config, EXCLUDE_KEY, SmellConfig.defaultExcludePatterns());

        Map<String, Object> report = section(config, REPORT_KEY);
        String formatName = getString(report, "format", ReportFormat.JSON.extension());
        ReportFormat format = ReportFormat.fromName(formatName)
                .orElseThrow(() -> new InvalidConfigurationException(
                        "report.format must be json or txt, got: " + formatName));

        return new SmellConfig(longMethodOptions, godClassOptions, parameterOptions, magicOptions,
                duplicateOptions, envyOptions, excludePatterns, format);
    }

    private static Map<String, Object> section(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) value;
            return map;
        }
        throw new InvalidConfigurationException("'" + key + "' must be a map of options");
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer integer) {
            return integer;
        }
        if (value instanceof Long || value instanceof BigInteger) {
            throw typeError(key, "an integer between " + Integer.MIN_VALUE + " and " + Integer.MAX_VALUE, value);
        }
        throw typeError(key, "an integer", value);
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw typeError(key, "a number", value);
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw typeError(key, "true or false", value);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<Double> getListDouble(Map<String, Object> map, String key, List<Double> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof List<?> list)) {
            throw typeError(key, "a list of numbers", value);
        }
        List<Double> numbers = new ArrayList<>();
        for (Object element : list) {
            if (!(element instanceof Number number)) {
                throw typeError(key, "a list of numbers", value);
            }
            numbers.add(number.doubleValue());
        }
        return numbers;
    }

    private static List<String> getListString(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof List<?> list)) {
            throw typeError(key, "a list of glob patterns", value);
        }
        List<String> strings = new ArrayList<>();
        for (Object element : list) {
            strings.add(String.valueOf(element));
        }
        return strings;
    }

    private static InvalidConfigurationException typeError(String key, String expected, Object value) {
        return new InvalidConfigurationException("'" + key + "' must be " + expected + ", got: " + value);
    }
}
