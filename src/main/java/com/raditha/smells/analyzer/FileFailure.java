package com.raditha.smells.analyzer;

import java.nio.file.Path;

/**
 * A file that could not be analyzed.
 *
 * @param sourceFile File that failed
 * @param message    Cause
 * @param line       Line of a parse problem, 0 if not a parse problem
 * @param column     Column of a parse problem, 0 if not a parse problem
 */
public record FileFailure(Path sourceFile, String message, int line, int column) {
}
