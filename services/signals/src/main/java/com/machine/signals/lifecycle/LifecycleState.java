package com.machine.signals.lifecycle;

/**
 * Service lifecycle: {@code STARTING -> READY -> DRAINING -> STOPPED}.
 */
public enum LifecycleState {
    STARTING,
    READY,
    DRAINING,
    STOPPED
}
