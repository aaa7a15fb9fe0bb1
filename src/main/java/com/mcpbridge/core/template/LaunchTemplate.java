package com.mcpbridge.core.template;

import com.mcpbridge.core.model.ServerDefinition;

import java.util.List;
import java.util.Map;

/**
 * The launch-relevant strings of a server definition, before or after template resolution.
 *
 * @param command          launch command
 * @param args             command arguments
 * @param env              environment variables
 * @param workingDirectory working directory, nullable
 * @param pathTemplates    named extra paths
 */
public record LaunchTemplate(
    String command,
    List<String> args,
    Map<String, String> env,
    String workingDirectory,
    Map<String, String> pathTemplates
) {

    public LaunchTemplate {
        args = args != null ? List.copyOf(args) : List.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        pathTemplates = pathTemplates != null ? Map.copyOf(pathTemplates) : Map.of();
    }

    public static LaunchTemplate from(ServerDefinition definition) {
        return new LaunchTemplate(definition.command(), definition.args(), definition.env(),
                definition.workingDirectory(), definition.pathTemplates());
    }
}
