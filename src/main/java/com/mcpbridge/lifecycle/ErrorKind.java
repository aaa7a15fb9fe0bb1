package com.mcpbridge.lifecycle;

/**
 * Classification of lifecycle failures, so callers can map them to a response
 * without inspecting exception types.
 */
public enum ErrorKind {
    ADMISSION,
    TEMPLATE_VALIDATION,
    SPAWN,
    CRASH,
    TIMEOUT,
    CLEANUP
}
