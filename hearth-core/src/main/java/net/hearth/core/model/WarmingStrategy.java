package net.hearth.core.model;

public enum WarmingStrategy {
    /** Warmed only when asked, or as a dependency of another source. */
    ON_DEMAND,
    /** Driven by the source's cron schedule. */
    SCHEDULED,
    /** Warmed once as soon as the source becomes active. */
    EAGER
}
