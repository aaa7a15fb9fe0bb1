package com.mcpbridge.process;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class StreamReadyHandshakeTest {

    private final StreamReadyHandshake handshake = new StreamReadyHandshake();

    @Test
    void liveProcessIsReady() throws Exception {
        var process = new ManagedProcess("i-1", new ProcessBuilder("sleep", "30").start());
        try {
            assertEquals(ProtocolSession.streamsOnly(), handshake.perform(process));
        } finally {
            process.kill();
        }
    }

    @Test
    void exitedProcessFails() throws Exception {
        var process = new ManagedProcess("i-1", new ProcessBuilder("sh", "-c", "exit 2").start());
        assertTrue(process.waitFor(Duration.ofSeconds(5)));

        var ex = assertThrows(HandshakeException.class, () -> handshake.perform(process));
        assertTrue(ex.getMessage().contains("code 2"));
    }
}
