package com.mcpbridge.lifecycle;

import java.util.List;

/**
 * Thrown when a resolved launch configuration fails path validation. Nothing is spawned.
 */
public class TemplateValidationException extends LifecycleException {

    private final List<String> violations;

    public TemplateValidationException(String serverName, List<String> violations) {
        super(ErrorKind.TEMPLATE_VALIDATION,
                "Launch configuration of '" + serverName + "' failed validation: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
