package net.hearth.core.error;

import java.util.Set;

/** Removal refused while other sources still depend on the target. */
public final class SourceInUseException extends WarmingException {
    private final Set<String> dependents;

    public SourceInUseException(String sourceId, Set<String> dependents) {
        super("Warming source " + sourceId + " is still required by " + dependents);
        this.dependents = Set.copyOf(dependents);
    }

    public Set<String> dependents() { return dependents; }
}
