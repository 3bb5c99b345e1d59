package com.raditha.smells.config;

import com.raditha.smells.detectors.DuplicatedCodeDetector;
import com.raditha.smells.detectors.FeatureEnvyDetector;
import com.raditha.smells.detectors.GodClassDetector;
import com.raditha.smells.detectors.LargeParameterListDetector;
import com.raditha.smells.detectors.LongMethodDetector;
import com.raditha.smells.detectors.MagicNumbersDetector;
import com.raditha.smells.detectors.SmellDetector;
import com.raditha.smells.model.SmellKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The detectors an analysis run actually uses.
 * Starts from the detectors enabled in the configuration, keeps only those
 * named by {@code --only} (when given), then drops those named by
 * {@code --exclude}.
 *
 * @param config Configuration supplying each detector's options
 * @param kinds  Selected smell kinds in declaration order
 */
public record DetectorSelection(SmellConfig config, List<SmellKind> kinds) {

    public DetectorSelection {
        kinds = List.copyOf(kinds);
    }

    /**
     * All detectors enabled in the configuration.
     */
    public static DetectorSelection of(SmellConfig config) {
        return resolve(config, List.of(), List.of());
    }

    /**
     * Resolve the selection.
     *
     * @param config  Configuration
     * @param only    Detector names to keep, empty for no restriction
     * @param exclude Detector names to drop
     * @throws InvalidConfigurationException if a name is not a known detector
     */
    public static DetectorSelection resolve(SmellConfig config, Collection<String> only,
            Collection<String> exclude) {
        Set<SmellKind> onlyKinds = parseNames(only);
        Set<SmellKind> excludeKinds = parseNames(exclude);

        List<SmellKind> selected = new ArrayList<>();
        for (SmellKind kind : config.enabledKinds()) {
            if (!onlyKinds.isEmpty() && !onlyKinds.contains(kind)) {
                continue;
            }
            if (excludeKinds.contains(kind)) {
                continue;
            }
            selected.add(kind);
        }
        return new DetectorSelection(config, selected);
    }

    private static Set<SmellKind> parseNames(Collection<String> names) {
        Set<SmellKind> kinds = EnumSet.noneOf(SmellKind.class);
        if (names == null) {
            return kinds;
        }
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            kinds.add(SmellKind.fromName(name).orElseThrow(() -> new InvalidConfigurationException(
                    "Unknown detector '" + name.trim() + "'. Known detectors: " + knownNames())));
        }
        return kinds;
    }

    private static String knownNames() {
        List<String> names = new ArrayList<>();
        for (SmellKind kind : SmellKind.values()) {
            names.add(kind.displayName());
        }
        return String.join(", ", names);
    }

    /**
     * Display names of the selected detectors.
     */
    public List<String> names() {
        return kinds.stream().map(SmellKind::displayName).toList();
    }

    /**
     * Create the selected detectors, each with its own options.
     */
    public List<SmellDetector> createDetectors() {
        List<SmellDetector> detectors = new ArrayList<>();
        for (SmellKind kind : kinds) {
            detectors.add(create(kind));
        }
        return detectors;
    }

    private SmellDetector create(SmellKind kind) {
        return switch (kind) {
            case LONG_METHOD -> new LongMethodDetector(config.longMethod());
            case GOD_CLASS -> new GodClassDetector(config.godClass());
            case DUPLICATED_CODE -> new DuplicatedCodeDetector(config.duplicatedCode());
            case LARGE_PARAMETER_LIST -> new LargeParameterListDetector(config.largeParameterList());
            case MAGIC_NUMBERS -> new MagicNumbersDetector(config.magicNumbers());
            case FEATURE_ENVY -> new FeatureEnvyDetector(config.featureEnvy());
        };
    }
}
