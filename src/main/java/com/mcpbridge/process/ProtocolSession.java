package com.mcpbridge.process;

/**
 * Outcome of a completed protocol handshake. Opaque to the lifecycle core beyond logging.
 *
 * @param protocolVersion negotiated protocol version, nullable when no handshake was performed
 * @param serverName      server-reported implementation name, nullable
 * @param serverVersion   server-reported implementation version, nullable
 */
public record ProtocolSession(
    String protocolVersion,
    String serverName,
    String serverVersion
) {

    private static final ProtocolSession STREAMS_ONLY = new ProtocolSession(null, null, null);

    /** Session for a process whose streams are open but which has not been greeted. */
    public static ProtocolSession streamsOnly() {
        return STREAMS_ONLY;
    }
}
