package com.mcpbridge.config;

import com.mcpbridge.core.model.ServerDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server definitions known to the bridge, keyed by logical name.
 */
@Component
public class ServerCatalog {

    private static final Logger log = LoggerFactory.getLogger(ServerCatalog.class);

    private final Map<String, ServerDefinition> definitions = new ConcurrentHashMap<>();

    public ServerCatalog(BridgeProperties properties) {
        properties.getServers().forEach((name, server) -> register(server.toDefinition(name)));
    }

    public void register(ServerDefinition definition) {
        definitions.put(definition.name(), definition);
        log.info("Server '{}' registered ({} lifecycle, command {})",
                definition.name(), definition.lifecycle().value(), definition.command());
    }

    public Optional<ServerDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public Collection<ServerDefinition> all() {
        return List.copyOf(definitions.values());
    }
}
