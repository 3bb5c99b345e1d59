package com.raditha.smells.analyzer;

import com.raditha.smells.config.DetectorSelection;
import com.raditha.smells.config.SmellConfig;
import com.raditha.smells.extraction.SourceParseException;
import com.raditha.smells.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Analyzes every Java file under a target, one file at a time. A file that
 * cannot be read or parsed is recorded as a failure and the run goes on.
 */
public class ProjectAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ProjectAnalyzer.class);

    private final SmellConfig config;
    private final DetectorSelection selection;
    private final SmellAnalyzer analyzer;

    public ProjectAnalyzer(DetectorSelection selection) {
        this.config = selection.config();
        this.selection = selection;
        this.analyzer = new SmellAnalyzer(selection.createDetectors());
    }

    /**
     * Analyze a single file or a directory tree.
     *
     * @param target Java file or directory
     * @return Report over all discovered files
     * @throws IOException if the target does not exist or the directory cannot
     *                     be walked
     */
    public ProjectReport analyze(Path target) throws IOException {
        List<Path> sources = findSourceFiles(target);
        logger.info("Analyzing {} Java file(s) with detectors: {}", sources.size(),
                String.join(", ", selection.names()));

        List<FileReport> reports = new ArrayList<>();
        List<FileFailure> failures = new ArrayList<>();
        for (Path source : sources) {
            try {
                String text = Files.readString(source, StandardCharsets.UTF_8);
                List<Finding> findings = analyzer.analyzeSource(text, source);
                reports.add(new FileReport(source, findings));
                logger.debug("{}: {} smell(s)", source, findings.size());
            } catch (SourceParseException e) {
                logger.warn("Skipping {}: {}", source, e.getMessage());
                failures.add(new FileFailure(source, e.getMessage(), e.getLine(), e.getColumn()));
            } catch (IOException e) {
                logger.warn("Could not read {}: {}", source, e.getMessage());
                failures.add(new FileFailure(source, e.getMessage(), 0, 0));
            }
        }

        return new ProjectReport(LocalDateTime.now(), target, selection.names(), reports, failures, config);
    }

    /**
     * Java files under the target in path order, excluded patterns removed.
     * Patterns are matched against the path relative to the target. A file
     * target is returned as is.
     */
    public List<Path> findSourceFiles(Path target) throws IOException {
        if (Files.isRegularFile(target)) {
            return List.of(target);
        }
        if (!Files.isDirectory(target)) {
            throw new IOException("Target not found: " + target);
        }

        try (Stream<Path> paths = Files.walk(target)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".java"))
                    .filter(p -> !config.shouldExclude(target.relativize(p).toString()))
                    .sorted()
                    .toList();
        }
    }
}
