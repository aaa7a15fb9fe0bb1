package com.mcpbridge.config;

import com.mcpbridge.core.model.LifecycleMode;
import com.mcpbridge.core.model.ResourceLimits;
import com.mcpbridge.core.model.ServerDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin-authored server definitions, bound from {@code mcpbridge.servers.<name>.*}.
 */
@Component
@ConfigurationProperties(prefix = "mcpbridge")
public class BridgeProperties {

    private Map<String, Server> servers = new LinkedHashMap<>();

    public Map<String, Server> getServers() { return servers; }
    public void setServers(Map<String, Server> servers) { this.servers = servers; }

    public static class Server {
        private String command;
        private List<String> args = new ArrayList<>();
        private String lifecycle = "global";
        private boolean requireAuth = false;
        private Map<String, String> pathTemplates = new LinkedHashMap<>();
        private Map<String, String> env = new LinkedHashMap<>();
        private String workingDirectory;
        private Integer maxMemoryMb;
        private Integer maxCpuPercent;
        private Integer timeoutMinutes;
        private Integer maxInstances;
        private Integer uid;
        private Integer gid;
        private boolean autoRestart = false;
        private int maxRetries = 3;

        public ServerDefinition toDefinition(String name) {
            if (command == null || command.isBlank()) {
                throw new IllegalStateException("mcpbridge.servers." + name + ".command is required");
            }
            return new ServerDefinition(name, command, args, LifecycleMode.fromValue(lifecycle), requireAuth,
                    pathTemplates, env, workingDirectory,
                    new ResourceLimits(maxMemoryMb, maxCpuPercent, timeoutMinutes, maxInstances),
                    uid, gid, autoRestart, maxRetries);
        }

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public List<String> getArgs() { return args; }
        public void setArgs(List<String> args) { this.args = args; }
        public String getLifecycle() { return lifecycle; }
        public void setLifecycle(String lifecycle) { this.lifecycle = lifecycle; }
        public boolean isRequireAuth() { return requireAuth; }
        public void setRequireAuth(boolean requireAuth) { this.requireAuth = requireAuth; }
        public Map<String, String> getPathTemplates() { return pathTemplates; }
        public void setPathTemplates(Map<String, String> pathTemplates) { this.pathTemplates = pathTemplates; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }
        public String getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
        public Integer getMaxMemoryMb() { return maxMemoryMb; }
        public void setMaxMemoryMb(Integer maxMemoryMb) { this.maxMemoryMb = maxMemoryMb; }
        public Integer getMaxCpuPercent() { return maxCpuPercent; }
        public void setMaxCpuPercent(Integer maxCpuPercent) { this.maxCpuPercent = maxCpuPercent; }
        public Integer getTimeoutMinutes() { return timeoutMinutes; }
        public void setTimeoutMinutes(Integer timeoutMinutes) { this.timeoutMinutes = timeoutMinutes; }
        public Integer getMaxInstances() { return maxInstances; }
        public void setMaxInstances(Integer maxInstances) { this.maxInstances = maxInstances; }
        public Integer getUid() { return uid; }
        public void setUid(Integer uid) { this.uid = uid; }
        public Integer getGid() { return gid; }
        public void setGid(Integer gid) { this.gid = gid; }
        public boolean isAutoRestart() { return autoRestart; }
        public void setAutoRestart(boolean autoRestart) { this.autoRestart = autoRestart; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }
}
