package com.camingest.camingest.service.worker;

/**
 * Lifecycle of a camera worker.
 * STOPPED -> STARTING -> CONNECTING -> STREAMING -> DISCONNECTED -> CONNECTING ...
 * Any state goes to STOPPED on an explicit stop.
 */
public enum WorkerState {
    STOPPED,
    STARTING,
    CONNECTING,
    STREAMING,
    DISCONNECTED
}
