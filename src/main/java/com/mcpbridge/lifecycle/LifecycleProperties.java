package com.mcpbridge.lifecycle;

import com.mcpbridge.core.model.LifecycleMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Configuration for instance lifecycle management, bound from {@code mcpbridge.lifecycle.*}.
 */
@Component
@ConfigurationProperties(prefix = "mcpbridge.lifecycle")
public class LifecycleProperties {

    /** "streams" treats open stdio as ready, "mcp" performs the initialize exchange. */
    private String handshake = "streams";
    private Duration startupTimeout = Duration.ofSeconds(10);
    /** Live instances per manager; 0 means unlimited. */
    private int maxInstancesPerManager = 0;
    private List<String> allowedPathPrefixes = new ArrayList<>();
    private Cleanup cleanup = new Cleanup();
    private Monitoring monitoring = new Monitoring();
    private Limits userLimits = new Limits();
    private Client client = new Client();

    public CleanupPolicy cleanupPolicyFor(LifecycleMode mode) {
        Duration idle = switch (mode) {
            case GLOBAL -> cleanup.idleTimeout.global;
            case USER -> cleanup.idleTimeout.user;
            case SESSION -> cleanup.idleTimeout.session;
        };
        return new CleanupPolicy(idle, cleanup.maxAge, cleanup.interval, cleanup.forcedGrace);
    }

    public UserLimits defaultUserLimits() {
        var modes = EnumSet.noneOf(LifecycleMode.class);
        userLimits.allowedModes.forEach(m -> modes.add(LifecycleMode.fromValue(m)));
        return new UserLimits(userLimits.maxInstances, modes, userLimits.maxMemoryMb,
                userLimits.maxCpuPercent, userLimits.timeoutMinutes);
    }

    public String getHandshake() { return handshake; }
    public void setHandshake(String handshake) { this.handshake = handshake; }
    public Duration getStartupTimeout() { return startupTimeout; }
    public void setStartupTimeout(Duration startupTimeout) { this.startupTimeout = startupTimeout; }
    public int getMaxInstancesPerManager() { return maxInstancesPerManager; }
    public void setMaxInstancesPerManager(int maxInstancesPerManager) { this.maxInstancesPerManager = maxInstancesPerManager; }
    public List<String> getAllowedPathPrefixes() { return allowedPathPrefixes; }
    public void setAllowedPathPrefixes(List<String> allowedPathPrefixes) { this.allowedPathPrefixes = allowedPathPrefixes; }
    public Cleanup getCleanup() { return cleanup; }
    public void setCleanup(Cleanup cleanup) { this.cleanup = cleanup; }
    public Monitoring getMonitoring() { return monitoring; }
    public void setMonitoring(Monitoring monitoring) { this.monitoring = monitoring; }
    public Limits getUserLimits() { return userLimits; }
    public void setUserLimits(Limits userLimits) { this.userLimits = userLimits; }
    public Client getClient() { return client; }
    public void setClient(Client client) { this.client = client; }

    public static class Cleanup {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(10);
        private Duration maxAge = Duration.ofHours(24);
        private Duration forcedGrace = Duration.ofSeconds(5);
        /** A tick that finds the previous sweep still running is skipped when true. */
        private boolean skipOverlappingTicks = true;
        private IdleTimeout idleTimeout = new IdleTimeout();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }
        public Duration getForcedGrace() { return forcedGrace; }
        public void setForcedGrace(Duration forcedGrace) { this.forcedGrace = forcedGrace; }
        public boolean isSkipOverlappingTicks() { return skipOverlappingTicks; }
        public void setSkipOverlappingTicks(boolean skipOverlappingTicks) { this.skipOverlappingTicks = skipOverlappingTicks; }
        public IdleTimeout getIdleTimeout() { return idleTimeout; }
        public void setIdleTimeout(IdleTimeout idleTimeout) { this.idleTimeout = idleTimeout; }
    }

    public static class IdleTimeout {
        private Duration global = Duration.ofMinutes(30);
        private Duration user = Duration.ofMinutes(30);
        private Duration session = Duration.ofMinutes(15);

        public Duration getGlobal() { return global; }
        public void setGlobal(Duration global) { this.global = global; }
        public Duration getUser() { return user; }
        public void setUser(Duration user) { this.user = user; }
        public Duration getSession() { return session; }
        public void setSession(Duration session) { this.session = session; }
    }

    public static class Monitoring {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }

    public static class Limits {
        private int maxInstances = 5;
        private List<String> allowedModes = new ArrayList<>(List.of("user", "session"));
        private int maxMemoryMb = 1024;
        private int maxCpuPercent = 50;
        private int timeoutMinutes = 60;

        public int getMaxInstances() { return maxInstances; }
        public void setMaxInstances(int maxInstances) { this.maxInstances = maxInstances; }
        public List<String> getAllowedModes() { return allowedModes; }
        public void setAllowedModes(List<String> allowedModes) { this.allowedModes = allowedModes; }
        public int getMaxMemoryMb() { return maxMemoryMb; }
        public void setMaxMemoryMb(int maxMemoryMb) { this.maxMemoryMb = maxMemoryMb; }
        public int getMaxCpuPercent() { return maxCpuPercent; }
        public void setMaxCpuPercent(int maxCpuPercent) { this.maxCpuPercent = maxCpuPercent; }
        public int getTimeoutMinutes() { return timeoutMinutes; }
        public void setTimeoutMinutes(int timeoutMinutes) { this.timeoutMinutes = timeoutMinutes; }
    }

    public static class Client {
        private String name = "mcp-bridge";
        private String version = "0.1.0";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
    }
}
