package net.hearth.core.model;

/** Why a warming execution happened. */
public enum WarmTrigger {
    SCHEDULE,
    DEPENDENCY,
    RETRY,
    MANUAL,
    EAGER
}
