package org.ls8.runtime;

/**
 * Lifecycle of an {@link ExecutionEngine}. There is no pause state; a halted engine only
 * runs again after a new program is loaded.
 */
public enum EngineState {
    RUNNING,
    HALTED
}
