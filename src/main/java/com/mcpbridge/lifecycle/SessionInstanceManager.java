package com.mcpbridge.lifecycle;

import com.mcpbridge.core.model.CallerContext;
import com.mcpbridge.core.model.InstanceKey;
import com.mcpbridge.core.model.LifecycleMode;
import com.mcpbridge.core.model.ServerDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One instance per (server, user, session).
 */
public class SessionInstanceManager extends AbstractInstanceManager {

    private final UserLimitsRegistry limits;

    public SessionInstanceManager(ManagerSupport support, CleanupPolicy policy, UserLimitsRegistry limits) {
        super(support, policy);
        this.limits = limits;
    }

    @Override
    public LifecycleMode mode() {
        return LifecycleMode.SESSION;
    }

    @Override
    public InstanceKey keyFor(ServerDefinition definition, CallerContext context) {
        if (!context.hasUser() || !context.hasSession()) {
            throw new AdmissionException(AdmissionException.MISSING_IDENTITY,
                    "Server '" + definition.name() + "' runs per session and requires both a user id and a session id");
        }
        return InstanceKey.session(definition.name(), context.userId(), context.sessionId());
    }

    @Override
    protected void checkAdmission(InstanceKey key, ServerDefinition definition, CallerContext context) {
        UserLimitsCheck.enforce(limits.getUserLimits(key.userId()), key, definition,
                liveCount(k -> key.userId().equals(k.userId())));
    }

    @Override
    protected Map<String, String> variablesFor(CallerContext context) {
        return support.resolver().createVariables(context);
    }

    @Override
    protected Map<String, String> scopeEnvironment(CallerContext context) {
        var env = new LinkedHashMap<String, String>();
        env.put("MCP_USER_ID", context.userId());
        env.put("MCP_USER_EMAIL", context.userEmail() != null ? context.userEmail() : "");
        env.put("MCP_SESSION_ID", context.sessionId());
        env.put("MCP_LIFECYCLE_MODE", mode().value());
        return env;
    }

    public UserLimitsRegistry getLimits() {
        return limits;
    }
}
