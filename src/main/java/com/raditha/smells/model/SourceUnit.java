package com.raditha.smells.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Structural model of one compilation unit.
 * Built once by the source model builder and only read afterwards.
 *
 * @param sourceFile Path of the analyzed file (may be a synthetic name)
 * @param lineCount  Number of lines in the source text
 * @param classes    All classes in source order, nested and anonymous ones included
 * @param functions  All functions in source order
 * @param literals   Numeric literal occurrences in source order
 */
public record SourceUnit(
        Path sourceFile,
        int lineCount,
        List<ClassDef> classes,
        List<FunctionDef> functions,
        List<LiteralOccurrence> literals) {

    public SourceUnit {
        classes = List.copyOf(classes);
        functions = List.copyOf(functions);
        literals = List.copyOf(literals);
    }

    /**
     * Functions not declared inside any class.
     */
    public List<FunctionDef> topLevelFunctions() {
        return functions.stream()
                .filter(f -> f.owningClass() == null)
                .toList();
    }

    public boolean isEmpty() {
        return classes.isEmpty() && functions.isEmpty() && literals.isEmpty();
    }

    /**
     * Get source file name.
     */
    public String getFileName() {
        return sourceFile != null && sourceFile.getFileName() != null
                ? sourceFile.getFileName().toString()
                : "unknown";
    }
}
