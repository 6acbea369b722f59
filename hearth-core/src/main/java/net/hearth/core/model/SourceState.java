package net.hearth.core.model;

/**
 * Per-source lifecycle: {@code IDLE -> DUE -> WARMING -> SUCCEEDED | FAILED -> IDLE}.
 * A failure with retries left parks the source in {@code BACKOFF} until the retry or the next natural run.
 */
public enum SourceState {
    IDLE,
    DUE,
    WARMING,
    SUCCEEDED,
    FAILED,
    BACKOFF
}
