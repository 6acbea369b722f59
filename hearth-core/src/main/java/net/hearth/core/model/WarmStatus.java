package net.hearth.core.model;

public enum WarmStatus {
    SUCCEEDED,
    FAILED,
    /** Not executed: the scheduler was disabled or the source was removed mid-flight. */
    SKIPPED
}
