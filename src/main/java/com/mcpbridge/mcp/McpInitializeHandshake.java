package com.mcpbridge.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpbridge.process.HandshakeException;
import com.mcpbridge.process.ManagedProcess;
import com.mcpbridge.process.ProtocolHandshake;
import com.mcpbridge.process.ProtocolSession;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Performs the MCP {@code initialize} exchange over a child's stdio using newline-delimited
 * JSON-RPC, then sends {@code notifications/initialized}.
 * <p>
 * Standard output is read one byte at a time so nothing past the response line is consumed;
 * the streams stay open for the client that attaches afterwards.
 */
public class McpInitializeHandshake implements ProtocolHandshake {

    private static final Logger log = LoggerFactory.getLogger(McpInitializeHandshake.class);

    private final ObjectMapper mapper;
    private final McpSchema.Implementation clientInfo;

    public McpInitializeHandshake(ObjectMapper mapper, String clientName, String clientVersion) {
        this.mapper = mapper;
        this.clientInfo = new McpSchema.Implementation(clientName, clientVersion);
    }

    @Override
    public ProtocolSession perform(ManagedProcess process) {
        String requestId = "init-" + UUID.randomUUID();
        var initialize = new McpSchema.InitializeRequest(
                McpSchema.LATEST_PROTOCOL_VERSION,
                McpSchema.ClientCapabilities.builder().build(),
                clientInfo);
        var request = new McpSchema.JSONRPCRequest(
                McpSchema.JSONRPC_VERSION, McpSchema.METHOD_INITIALIZE, requestId, initialize);

        try {
            send(process.stdin(), request);
            JsonNode response = awaitResponse(process, requestId);

            if (response.hasNonNull("error")) {
                JsonNode error = response.get("error");
                throw new HandshakeException("Server refused initialize: "
                        + error.path("message").asText("unknown error")
                        + " (code " + error.path("code").asText("?") + ")");
            }

            JsonNode result = response.path("result");
            var session = new ProtocolSession(
                    textOrNull(result.path("protocolVersion")),
                    textOrNull(result.path("serverInfo").path("name")),
                    textOrNull(result.path("serverInfo").path("version")));

            send(process.stdin(), new McpSchema.JSONRPCNotification(
                    McpSchema.JSONRPC_VERSION, McpSchema.METHOD_NOTIFICATION_INITIALIZED, null));

            log.info("MCP handshake completed for instance {}: server {} {} (protocol {})",
                    process.getInstanceId(), session.serverName(), session.serverVersion(),
                    session.protocolVersion());
            return session;
        } catch (IOException e) {
            throw new HandshakeException("MCP handshake I/O failure: " + e.getMessage(), e);
        }
    }

    private void send(OutputStream stdin, Object message) throws IOException {
        byte[] line = (mapper.writeValueAsString(message) + "\n").getBytes(StandardCharsets.UTF_8);
        stdin.write(line);
        stdin.flush();
    }

    private JsonNode awaitResponse(ManagedProcess process, String requestId) throws IOException {
        InputStream stdout = process.stdout();
        while (true) {
            String line = readLine(stdout);
            if (line == null) {
                throw new HandshakeException("Process closed stdout before answering initialize"
                        + (process.isAlive() ? "" : " (exit " + process.getExitCode() + ")"));
            }
            if (line.isBlank()) continue;

            JsonNode node;
            try {
                node = mapper.readTree(line);
            } catch (JsonProcessingException e) {
                log.debug("Ignoring non-JSON output from instance {}: {}", process.getInstanceId(), line);
                continue;
            }
            if (node.isObject() && requestId.equals(node.path("id").asText(null))) {
                return node;
            }
            log.debug("Ignoring message from instance {} while awaiting initialize: {}",
                    process.getInstanceId(), line);
        }
    }

    static String readLine(InputStream in) throws IOException {
        var buffer = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                return buffer.toString(StandardCharsets.UTF_8).stripTrailing();
            }
            buffer.write(b);
        }
        return buffer.size() > 0 ? buffer.toString(StandardCharsets.UTF_8) : null;
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
