package com.mcpbridge.process;

import java.util.List;
import java.util.Map;

/**
 * Fully resolved and validated launch parameters for one child process.
 *
 * @param instanceId       id of the instance the process will back
 * @param serverName       logical server name, used for thread names and logs
 * @param command          executable
 * @param args             arguments
 * @param environment      variables layered over the inherited environment
 * @param workingDirectory working directory, nullable for the control process's own
 * @param uid              POSIX user id to run as, nullable
 * @param gid              POSIX group id to run as, nullable
 */
public record LaunchRequest(
    String instanceId,
    String serverName,
    String command,
    List<String> args,
    Map<String, String> environment,
    String workingDirectory,
    Integer uid,
    Integer gid
) {

    public LaunchRequest {
        args = args != null ? List.copyOf(args) : List.of();
        environment = environment != null ? Map.copyOf(environment) : Map.of();
    }

    public boolean dropsPrivileges() {
        return uid != null || gid != null;
    }
}
