package com.mcpbridge.process;

import com.mcpbridge.lifecycle.SpawnException;

/**
 * Starts child processes for instances.
 */
public interface ProcessLauncher {

    /**
     * Starts the process described by the request.
     *
     * @param request resolved launch parameters
     * @return a handle owning the started process
     * @throws SpawnException if the process cannot be started or the privilege drop fails
     */
    ManagedProcess launch(LaunchRequest request);
}
