package com.mcpbridge.config;

import com.mcpbridge.core.model.LifecycleMode;
import com.mcpbridge.core.model.ServerDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerCatalogTest {

    @Test
    @DisplayName("registers every configured server")
    void registersConfiguredServers() {
        var props = new BridgeProperties();
        var server = new BridgeProperties.Server();
        server.setCommand("node");
        server.setLifecycle("session");
        props.getServers().put("scratch", server);

        var catalog = new ServerCatalog(props);

        assertEquals(1, catalog.all().size());
        assertEquals(LifecycleMode.SESSION, catalog.find("scratch").orElseThrow().lifecycle());
    }

    @Test
    @DisplayName("find returns empty for unknown servers")
    void unknownServer() {
        assertTrue(new ServerCatalog(new BridgeProperties()).find("nope").isEmpty());
    }

    @Test
    @DisplayName("register replaces a definition of the same name")
    void registerReplaces() {
        var catalog = new ServerCatalog(new BridgeProperties());
        catalog.register(ServerDefinition.builder("files", "node").build());
        catalog.register(ServerDefinition.builder("files", "python3").build());

        assertEquals("python3", catalog.find("files").orElseThrow().command());
        assertEquals(1, catalog.all().size());
    }
}
