package com.mcpbridge.core.template;

import java.util.List;

/**
 * Outcome of validating one or more resolved strings.
 *
 * @param valid    {@code true} when no error was found
 * @param errors   violated rules, one message each
 * @param warnings suspicious but tolerated findings
 */
public record PathValidationResult(
    boolean valid,
    List<String> errors,
    List<String> warnings
) {

    public PathValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static PathValidationResult of(List<String> errors, List<String> warnings) {
        return new PathValidationResult(errors.isEmpty(), errors, warnings);
    }
}
