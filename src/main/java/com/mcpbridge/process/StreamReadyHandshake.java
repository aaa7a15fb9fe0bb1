package com.mcpbridge.process;

/**
 * Treats a process as ready as soon as it is alive with its standard streams open,
 * leaving the protocol exchange to the client that later attaches to those streams.
 */
public class StreamReadyHandshake implements ProtocolHandshake {

    @Override
    public ProtocolSession perform(ManagedProcess process) {
        if (!process.isAlive()) {
            throw new HandshakeException("Process exited with code " + process.getExitCode()
                    + " before its streams were ready");
        }
        return ProtocolSession.streamsOnly();
    }
}
