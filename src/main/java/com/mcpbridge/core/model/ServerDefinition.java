package com.mcpbridge.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Admin-authored definition of a backend MCP server. Immutable; read-only to the lifecycle core.
 *
 * @param name             logical server name
 * @param command          launch command, may contain {@code {variable}} placeholders
 * @param args             argument templates
 * @param lifecycle        scope at which instances are shared
 * @param requireAuth      whether callers must be authenticated to use the server
 * @param pathTemplates    extra named path templates validated before spawn
 * @param env              environment variable templates
 * @param workingDirectory working directory template, nullable
 * @param resourceLimits   resource ceilings, never null
 * @param uid              POSIX user id to run as, nullable
 * @param gid              POSIX group id to run as, nullable
 * @param autoRestart      re-create crashed instances under the same identity
 * @param maxRetries       auto-restart budget per identity
 */
public record ServerDefinition(
    String name,
    String command,
    List<String> args,
    LifecycleMode lifecycle,
    boolean requireAuth,
    Map<String, String> pathTemplates,
    Map<String, String> env,
    String workingDirectory,
    ResourceLimits resourceLimits,
    Integer uid,
    Integer gid,
    boolean autoRestart,
    int maxRetries
) implements Serializable {

    public ServerDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(lifecycle, "lifecycle");
        args = args != null ? List.copyOf(args) : List.of();
        pathTemplates = pathTemplates != null ? Map.copyOf(pathTemplates) : Map.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        resourceLimits = resourceLimits != null ? resourceLimits : ResourceLimits.none();
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
    }

    public static Builder builder(String name, String command) {
        return new Builder(name, command);
    }

    public static final class Builder {
        private final String name;
        private final String command;
        private final List<String> args = new ArrayList<>();
        private LifecycleMode lifecycle = LifecycleMode.GLOBAL;
        private boolean requireAuth;
        private final Map<String, String> pathTemplates = new LinkedHashMap<>();
        private final Map<String, String> env = new LinkedHashMap<>();
        private String workingDirectory;
        private ResourceLimits resourceLimits = ResourceLimits.none();
        private Integer uid;
        private Integer gid;
        private boolean autoRestart;
        private int maxRetries;

        private Builder(String name, String command) {
            this.name = name;
            this.command = command;
        }

        public Builder args(String... values) {
            args.addAll(List.of(values));
            return this;
        }

        public Builder args(List<String> values) {
            args.addAll(values);
            return this;
        }

        public Builder lifecycle(LifecycleMode mode) {
            this.lifecycle = mode;
            return this;
        }

        public Builder requireAuth(boolean requireAuth) {
            this.requireAuth = requireAuth;
            return this;
        }

        public Builder pathTemplate(String key, String template) {
            pathTemplates.put(key, template);
            return this;
        }

        public Builder env(String key, String template) {
            env.put(key, template);
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder resourceLimits(ResourceLimits resourceLimits) {
            this.resourceLimits = resourceLimits;
            return this;
        }

        public Builder runAs(Integer uid, Integer gid) {
            this.uid = uid;
            this.gid = gid;
            return this;
        }

        public Builder autoRestart(boolean autoRestart, int maxRetries) {
            this.autoRestart = autoRestart;
            this.maxRetries = maxRetries;
            return this;
        }

        public ServerDefinition build() {
            return new ServerDefinition(name, command, args, lifecycle, requireAuth, pathTemplates,
                    env, workingDirectory, resourceLimits, uid, gid, autoRestart, maxRetries);
        }
    }
}
