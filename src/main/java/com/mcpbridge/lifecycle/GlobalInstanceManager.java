package com.mcpbridge.lifecycle;

import com.mcpbridge.core.model.CallerContext;
import com.mcpbridge.core.model.InstanceKey;
import com.mcpbridge.core.model.LifecycleMode;
import com.mcpbridge.core.model.ServerDefinition;

import java.util.Map;

/**
 * One instance per server name, shared by every caller.
 * <p>
 * Caller identity never reaches a global instance: neither its template variables nor its
 * environment carry user or session fields.
 */
public class GlobalInstanceManager extends AbstractInstanceManager {

    public GlobalInstanceManager(ManagerSupport support, CleanupPolicy policy) {
        super(support, policy);
    }

    @Override
    public LifecycleMode mode() {
        return LifecycleMode.GLOBAL;
    }

    @Override
    public InstanceKey keyFor(ServerDefinition definition, CallerContext context) {
        return InstanceKey.global(definition.name());
    }

    @Override
    protected Map<String, String> variablesFor(CallerContext context) {
        return support.resolver().createVariables(null, null, null, context.requestId(), context.timestamp());
    }

    @Override
    protected Map<String, String> scopeEnvironment(CallerContext context) {
        return Map.of("MCP_LIFECYCLE_MODE", mode().value());
    }
}
