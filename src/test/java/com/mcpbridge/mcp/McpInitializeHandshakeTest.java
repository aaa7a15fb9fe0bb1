package com.mcpbridge.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpbridge.process.HandshakeException;
import com.mcpbridge.process.ManagedProcess;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class McpInitializeHandshakeTest {

    /** Extracts the request id from the initialize line and echoes it back in a canned response. */
    private static final String ECHO_ID =
            "read -r line; id=$(printf '%s' \"$line\" | sed -n 's/.*\"id\":\"\\(init-[^\"]*\\)\".*/\\1/p'); ";

    private final McpInitializeHandshake handshake =
            new McpInitializeHandshake(new ObjectMapper(), "mcp-bridge", "0.1.0");

    private ManagedProcess process;

    @AfterEach
    void tearDown() {
        if (process != null) {
            process.kill();
        }
    }

    private ManagedProcess fakeServer(String script) throws IOException {
        process = new ManagedProcess("i-1", new ProcessBuilder("sh", "-c", script).start());
        return process;
    }

    @Test
    @DisplayName("completes initialize and sends the initialized notification")
    void completesHandshake() throws Exception {
        var server = fakeServer(ECHO_ID
                + "echo 'booting...'; "
                + "echo '{\"jsonrpc\":\"2.0\",\"method\":\"notifications/message\"}'; "
                + "printf '{\"jsonrpc\":\"2.0\",\"id\":\"%s\",\"result\":{\"protocolVersion\":\"2024-11-05\","
                + "\"capabilities\":{},\"serverInfo\":{\"name\":\"fake\",\"version\":\"1.2.3\"}}}\\n' \"$id\"; "
                + "read -r notification; echo \"$notification\" >&2; exec sleep 30");

        var session = handshake.perform(server);

        assertEquals("2024-11-05", session.protocolVersion());
        assertEquals("fake", session.serverName());
        assertEquals("1.2.3", session.serverVersion());

        long deadline = System.currentTimeMillis() + 5000;
        while (server.getRecentStderr().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(server.getRecentStderr().get(0).contains("notifications/initialized"));
        assertTrue(server.isAlive());
    }

    @Test
    @DisplayName("an error response fails the handshake")
    void errorResponse() throws Exception {
        var server = fakeServer(ECHO_ID
                + "printf '{\"jsonrpc\":\"2.0\",\"id\":\"%s\",\"error\":{\"code\":-32602,"
                + "\"message\":\"unsupported protocol\"}}\\n' \"$id\"; exec sleep 30");

        var ex = assertThrows(HandshakeException.class, () -> handshake.perform(server));

        assertTrue(ex.getMessage().contains("unsupported protocol"));
        assertTrue(ex.getMessage().contains("-32602"));
    }

    @Test
    @DisplayName("a server that exits without answering fails the handshake")
    void closedStdout() throws Exception {
        var server = fakeServer("read line; exit 1");

        assertThrows(HandshakeException.class, () -> handshake.perform(server));
    }

    @Test
    @DisplayName("readLine splits on newlines and trims carriage returns")
    void readsLines() throws Exception {
        var in = new ByteArrayInputStream("first\r\n\nlast".getBytes(StandardCharsets.UTF_8));

        assertEquals("first", McpInitializeHandshake.readLine(in));
        assertEquals("", McpInitializeHandshake.readLine(in));
        assertEquals("last", McpInitializeHandshake.readLine(in));
        assertNull(McpInitializeHandshake.readLine(in));
    }
}
