package io.tsvstream.runtime;

/**
 * Lifecycle of the line source as seen by the buffer. Transitions only move forward.
 */
public enum SourceState {
    NOT_STARTED,
    ACTIVE,
    CLOSED
}
