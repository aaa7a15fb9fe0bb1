package com.mcpbridge.process;

import com.mcpbridge.lifecycle.SpawnException;
import com.sun.security.auth.module.UnixSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches child processes with {@link ProcessBuilder}.
 * <p>
 * The child inherits the control process's environment with the request's variables layered
 * on top. When a uid or gid is requested the command is wrapped with {@code setpriv}, which
 * switches identity before exec. The switch is checked up front: a control process that is
 * not root cannot change identity, and a missing {@code setpriv} binary aborts the launch
 * instead of running with the parent's privileges.
 */
public class DefaultProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(DefaultProcessLauncher.class);

    private static final String PRIVILEGE_WRAPPER = "setpriv";
    private static final Duration PRIVILEGE_CHECK_WINDOW = Duration.ofMillis(200);
    /** setpriv exits with 127 when it cannot exec, and 1 when the identity switch fails. */
    private static final int WRAPPER_EXEC_FAILED = 127;

    @Override
    public ManagedProcess launch(LaunchRequest request) {
        List<String> command = new ArrayList<>();
        boolean wrapped = false;

        if (request.dropsPrivileges() && needsSwitch(request)) {
            command.addAll(privilegeWrapper(request));
            wrapped = true;
        }
        command.add(request.command());
        command.addAll(request.args());

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(request.environment());
        if (request.workingDirectory() != null) {
            builder.directory(new File(request.workingDirectory()));
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new SpawnException("Failed to start '" + request.command() + "' for server '"
                    + request.serverName() + "': " + e.getMessage(), e);
        }

        var managed = new ManagedProcess(request.instanceId(), process);
        log.info("Started process for server '{}' (instance {}, pid {})",
                request.serverName(), request.instanceId(), managed.getPid());

        if (wrapped) {
            verifyPrivilegeDrop(request, managed);
        }
        return managed;
    }

    private static boolean needsSwitch(LaunchRequest request) {
        long currentUid;
        long currentGid;
        try {
            var unix = new UnixSystem();
            currentUid = unix.getUid();
            currentGid = unix.getGid();
        } catch (LinkageError e) {
            throw new SpawnException("Cannot run server '" + request.serverName()
                    + "' as another user: POSIX identity is not available on this platform", e);
        }

        boolean uidDiffers = request.uid() != null && request.uid() != currentUid;
        boolean gidDiffers = request.gid() != null && request.gid() != currentGid;
        if (!uidDiffers && !gidDiffers) {
            return false;
        }
        if (currentUid != 0) {
            throw new SpawnException("Cannot run server '" + request.serverName() + "' as uid="
                    + request.uid() + " gid=" + request.gid() + ": control process (uid " + currentUid
                    + ") lacks the privilege to switch identity");
        }
        return true;
    }

    private static List<String> privilegeWrapper(LaunchRequest request) {
        Path setpriv = locate(PRIVILEGE_WRAPPER);
        if (setpriv == null) {
            throw new SpawnException("Cannot run server '" + request.serverName()
                    + "' as another user: '" + PRIVILEGE_WRAPPER + "' was not found on PATH");
        }
        List<String> wrapper = new ArrayList<>();
        wrapper.add(setpriv.toString());
        if (request.uid() != null) {
            wrapper.add("--reuid=" + request.uid());
        }
        if (request.gid() != null) {
            wrapper.add("--regid=" + request.gid());
        }
        wrapper.add("--clear-groups");
        wrapper.add("--");
        return wrapper;
    }

    /**
     * A failed identity switch surfaces as an immediate non-zero exit of the wrapper.
     */
    private static void verifyPrivilegeDrop(LaunchRequest request, ManagedProcess managed) {
        try {
            if (!managed.waitFor(PRIVILEGE_CHECK_WINDOW)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            managed.kill();
            throw new SpawnException("Interrupted while starting server '" + request.serverName() + "'", e);
        }

        Integer exitCode = managed.getExitCode();
        if (exitCode != null && exitCode != 0) {
            String stderr = String.join("\n", managed.getRecentStderr());
            String what = exitCode == WRAPPER_EXEC_FAILED ? "could not exec" : "failed to switch identity";
            throw new SpawnException("Privilege drop for server '" + request.serverName() + "' "
                    + what + " (exit " + exitCode + ")" + (stderr.isBlank() ? "" : ": " + stderr));
        }
    }

    static Path locate(String executable) {
        String path = System.getenv("PATH");
        if (path == null) return null;
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, executable);
            if (Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
