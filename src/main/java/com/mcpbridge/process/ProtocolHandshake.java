package com.mcpbridge.process;

/**
 * Greets a freshly spawned process over its standard streams. An instance becomes
 * {@code RUNNING} only after this returns.
 * <p>
 * Implementations block; the caller enforces the startup timeout and kills the process
 * when it elapses.
 */
public interface ProtocolHandshake {

    /**
     * @param process the started process
     * @return the established session
     * @throws HandshakeException if the process refuses or cannot complete the handshake
     */
    ProtocolSession perform(ManagedProcess process);
}
