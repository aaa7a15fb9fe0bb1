package com.mcpbridge.core.template;

/**
 * A resolved launch template together with the aggregated validation of its strings.
 * A non-valid result is a hard refusal to spawn.
 */
public record ResolvedLaunchConfig(
    LaunchTemplate config,
    PathValidationResult validation
) {}
