package com.raditha.smells.config;

import com.raditha.smells.model.SmellKind;
import com.raditha.smells.report.ReportFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Complete, immutable configuration of an analysis run.
 * Detectors receive their own options record; nothing reads ambient state.
 *
 * @param longMethod         Long method options
 * @param godClass           God class options
 * @param largeParameterList Large parameter list options
 * @param magicNumbers       Magic number options
 * @param duplicatedCode     Duplicated code options
 * @param featureEnvy        Feature envy options
 * @param excludePatterns    File patterns to exclude from directory scans (glob
 *                           format)
 * @param reportFormat       Report file format
 */
public record SmellConfig(
        LongMethodOptions longMethod,
        GodClassOptions godClass,
        LargeParameterListOptions largeParameterList,
        MagicNumbersOptions magicNumbers,
        DuplicatedCodeOptions duplicatedCode,
        FeatureEnvyOptions featureEnvy,
        List<String> excludePatterns,
        ReportFormat reportFormat) {

    public SmellConfig {
        InvalidConfigurationException.require(longMethod != null && godClass != null
                && largeParameterList != null && magicNumbers != null
                && duplicatedCode != null && featureEnvy != null,
                "detector options cannot be null");
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        if (reportFormat == null) {
            reportFormat = ReportFormat.JSON;
        }
    }

    /**
     * All detectors enabled with their default thresholds.
     */
    public static SmellConfig defaults() {
        return new SmellConfig(
                LongMethodOptions.defaults(),
                GodClassOptions.defaults(),
                LargeParameterListOptions.defaults(),
                MagicNumbersOptions.defaults(),
                DuplicatedCodeOptions.defaults(),
                FeatureEnvyOptions.defaults(),
                defaultExcludePatterns(),
                ReportFormat.JSON);
    }

    /**
     * Default file exclusion patterns.
     */
    public static List<String> defaultExcludePatterns() {
        return List.of(
                "**/target/**",
                "**/build/**",
                "**/.git/**");
    }

    public boolean isEnabled(SmellKind kind) {
        return switch (kind) {
            case LONG_METHOD -> longMethod.enabled();
            case GOD_CLASS -> godClass.enabled();
            case DUPLICATED_CODE -> duplicatedCode.enabled();
            case LARGE_PARAMETER_LIST -> largeParameterList.enabled();
            case MAGIC_NUMBERS -> magicNumbers.enabled();
            case FEATURE_ENVY -> featureEnvy.enabled();
        };
    }

    /**
     * Enabled smell kinds in declaration order.
     */
    public List<SmellKind> enabledKinds() {
        List<SmellKind> kinds = new ArrayList<>();
        for (SmellKind kind : SmellKind.values()) {
            if (isEnabled(kind)) {
                kinds.add(kind);
            }
        }
        return kinds;
    }

    public SmellConfig withLongMethod(LongMethodOptions options) {
        return new SmellConfig(options, godClass, largeParameterList, magicNumbers, duplicatedCode,
                featureEnvy, excludePatterns, reportFormat);
    }

    public SmellConfig withFeatureEnvy(FeatureEnvyOptions options) {
        return new SmellConfig(longMethod, godClass, largeParameterList, magicNumbers, duplicatedCode,
                options, excludePatterns, reportFormat);
    }

    public SmellConfig withReportFormat(ReportFormat format) {
        return new SmellConfig(longMethod, godClass, largeParameterList, magicNumbers, duplicatedCode,
                featureEnvy, excludePatterns, format);
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        String normalized = filePath.replace('\\', '/');
        for (String pattern : excludePatterns) {
            if (globToPattern(pattern).matcher(normalized).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports ** (any path, separators included), * (within one path segment)
     * and ? wildcards. A leading "**&#47;" also matches paths without a directory.
     */
    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (glob.startsWith("**/", i)) {
                regex.append("(?:.*/)?");
                i += 3;
                continue;
            }
            if (glob.startsWith("**", i)) {
                regex.append(".*");
                i += 2;
                continue;
            }
            if (c == '*') {
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString());
    }
}
