package com.raditha.smells.analyzer;

import com.raditha.smells.config.DetectorSelection;
import com.raditha.smells.config.SmellConfig;
import com.raditha.smells.detectors.SmellDetector;
import com.raditha.smells.extraction.SourceModelBuilder;
import com.raditha.smells.extraction.SourceParseException;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.SmellKind;
import com.raditha.smells.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the selected detectors over one source unit.
 * Coordinates model building, detection and aggregation.
 */
public class SmellAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SmellAnalyzer.class);

    private final List<SmellDetector> detectors;
    private final SourceModelBuilder builder;
    private final FindingAggregator aggregator;

    /**
     * Create analyzer with all detectors and default thresholds.
     */
    public SmellAnalyzer() {
        this(SmellConfig.defaults());
    }

    /**
     * Create analyzer running every detector enabled in the configuration.
     */
    public SmellAnalyzer(SmellConfig config) {
        this(DetectorSelection.of(config).createDetectors());
    }

    public SmellAnalyzer(List<SmellDetector> detectors) {
        this.detectors = List.copyOf(detectors);
        this.builder = new SourceModelBuilder();
        this.aggregator = new FindingAggregator();
    }

    /**
     * Smell kinds this analyzer reports, in detector order.
     */
    public List<SmellKind> kinds() {
        return detectors.stream().map(SmellDetector::kind).toList();
    }

    /**
     * Analyze an already built unit.
     */
    public List<Finding> analyze(SourceUnit unit) {
        List<List<Finding>> outputs = new ArrayList<>();
        for (SmellDetector detector : detectors) {
            List<Finding> findings = detector.detect(unit);
            logger.debug("{}: {} reported {} finding(s)", unit.getFileName(), detector.kind(), findings.size());
            outputs.add(findings);
        }
        return aggregator.aggregate(outputs);
    }

    /**
     * Parse and analyze source text.
     *
     * @param source     Java source text
     * @param sourceFile Path reported in findings
     * @return Ordered findings
     * @throws SourceParseException if the text is not valid Java; no findings are
     *                              produced for it
     */
    public List<Finding> analyzeSource(String source, Path sourceFile) throws SourceParseException {
        return analyze(builder.build(source, sourceFile));
    }

    /**
     * Parse and analyze in-memory source text.
     */
    public List<Finding> analyzeSource(String source) throws SourceParseException {
        return analyze(builder.build(source));
    }
}
