package com.mcpbridge.process;

import com.mcpbridge.lifecycle.SpawnException;
import com.sun.security.auth.module.UnixSystem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class DefaultProcessLauncherTest {

    private final DefaultProcessLauncher launcher = new DefaultProcessLauncher();
    private final List<ManagedProcess> started = new ArrayList<>();

    @AfterEach
    void tearDown() {
        started.forEach(ManagedProcess::kill);
    }

    private ManagedProcess launch(String command, List<String> args, Map<String, String> env,
                                  String workingDirectory, Integer uid, Integer gid) {
        var process = launcher.launch(new LaunchRequest("i-1", "test", command, args, env, workingDirectory, uid, gid));
        started.add(process);
        return process;
    }

    private static String firstLine(ManagedProcess process) throws IOException {
        try (var reader = new BufferedReader(new InputStreamReader(process.stdout(), StandardCharsets.UTF_8))) {
            return reader.readLine();
        }
    }

    @Test
    @DisplayName("layers request variables over the inherited environment")
    void passesEnvironment() throws Exception {
        var process = launch("sh", List.of("-c", "echo \"$GREETING $PATH\""),
                Map.of("GREETING", "hello"), null, null, null);

        String line = firstLine(process);

        assertTrue(line.startsWith("hello "));
        assertTrue(line.length() > "hello ".length(), "PATH should be inherited");
    }

    @Test
    @DisplayName("runs in the requested working directory")
    void usesWorkingDirectory(@TempDir Path dir) throws Exception {
        var process = launch("pwd", List.of(), Map.of(), dir.toString(), null, null);

        assertEquals(dir.toRealPath().toString(), Path.of(firstLine(process)).toRealPath().toString());
    }

    @Test
    @DisplayName("a missing executable fails with SpawnException")
    void missingExecutable() {
        var ex = assertThrows(SpawnException.class,
                () -> launch("/nonexistent/mcp-server", List.of(), Map.of(), null, null, null));

        assertTrue(ex.getMessage().contains("/nonexistent/mcp-server"));
    }

    @Test
    @DisplayName("requesting the current identity does not wrap the command")
    void currentIdentityIsNotWrapped() throws Exception {
        var unix = new UnixSystem();
        var process = launch("id", List.of("-u"), Map.of(), null, (int) unix.getUid(), (int) unix.getGid());

        assertEquals(Long.toString(unix.getUid()), firstLine(process));
    }

    @Test
    @DisplayName("a non-root control process cannot switch identity")
    void nonRootCannotSwitch() {
        assumeTrue(new UnixSystem().getUid() != 0, "requires a non-root test run");

        var ex = assertThrows(SpawnException.class,
                () -> launch("id", List.of("-u"), Map.of(), null, 65534, 65534));

        assertTrue(ex.getMessage().contains("lacks the privilege"));
    }

    @Test
    @DisplayName("root drops to the requested uid and gid via setpriv")
    void rootDropsPrivileges() throws Exception {
        assumeTrue(new UnixSystem().getUid() == 0, "requires root");
        assumeTrue(DefaultProcessLauncher.locate("setpriv") != null, "requires setpriv");

        var process = launch("sh", List.of("-c", "echo \"$(id -u):$(id -g)\""), Map.of(), "/tmp", 65534, 65534);

        assertEquals("65534:65534", firstLine(process));
        assertTrue(process.waitFor(Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("locate finds executables on PATH")
    void locatesOnPath() {
        assertNotNull(DefaultProcessLauncher.locate("sh"));
        assertNull(DefaultProcessLauncher.locate("definitely-not-an-executable-name"));
    }
}
