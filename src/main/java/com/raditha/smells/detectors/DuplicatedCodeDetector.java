package com.raditha.smells.detectors;

import com.raditha.smells.config.DuplicatedCodeOptions;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.FunctionDef;
import com.raditha.smells.model.Severity;
import com.raditha.smells.model.SmellKind;
import com.raditha.smells.model.SourceUnit;
import com.raditha.smells.similarity.SimilarityCalculator;
import com.raditha.smells.similarity.SimilarityCalculator.Fingerprint;
import com.raditha.smells.similarity.SimilarityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds pairs of function bodies with substantially similar statements.
 * <p>
 * Every eligible function is reduced to its normalized token form and its
 * statement-kind sequence. Each unordered pair is compared once, earlier
 * function first, and reported when the better of the token and structural
 * scores reaches the configured similarity.
 */
public class DuplicatedCodeDetector implements SmellDetector {

    private static final Logger logger = LoggerFactory.getLogger(DuplicatedCodeDetector.class);

    private final DuplicatedCodeOptions options;
    private final SimilarityCalculator calculator;

    public DuplicatedCodeDetector(DuplicatedCodeOptions options) {
        this(options, new SimilarityCalculator());
    }

    public DuplicatedCodeDetector(DuplicatedCodeOptions options, SimilarityCalculator calculator) {
        this.options = Thresholds.requireOptions(options, "DuplicatedCode");
        this.calculator = calculator;
    }

    @Override
    public SmellKind kind() {
        return SmellKind.DUPLICATED_CODE;
    }

    @Override
    public List<Finding> detect(SourceUnit unit) {
        List<Fingerprint> candidates = new ArrayList<>();
        for (FunctionDef function : unit.functions()) {
            Fingerprint fingerprint = calculator.fingerprint(function);
            if (fingerprint.statementCount() >= options.minChunkSize()) {
                candidates.add(fingerprint);
            }
        }
        logger.debug("{}: {} of {} functions eligible for duplicate comparison",
                unit.getFileName(), candidates.size(), unit.functions().size());

        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                Fingerprint first = candidates.get(i);
                Fingerprint second = candidates.get(j);
                int shorter = Math.min(first.function().lineCount(), second.function().lineCount());
                if (shorter < options.minChunkSize()) {
                    continue;
                }
                SimilarityResult similarity = calculator.compare(first, second);
                if (similarity.exceedsThreshold(options.minSimilarity())) {
                    findings.add(toFinding(first.function(), second.function(), similarity));
                }
            }
        }
        return findings;
    }

    private Finding toFinding(FunctionDef first, FunctionDef second, SimilarityResult similarity) {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("similarity", similarity.overallScore());
        metrics.put("tokenSimilarity", similarity.tokenScore());
        metrics.put("structuralSimilarity", similarity.structuralScore());
        metrics.put("minSimilarity", options.minSimilarity());

        return new Finding(
                kind(),
                Severity.MEDIUM,
                first.range(),
                first.qualifiedName() + " / " + second.qualifiedName(),
                String.format("Duplicated code detected between '%s' (%s) and '%s' (%s) (similarity: %.2f)",
                        first.qualifiedName(), first.range().toDisplayString(),
                        second.qualifiedName(), second.range().toDisplayString(),
                        similarity.overallScore()),
                metrics,
                List.of(first.range(), second.range()));
    }
}
