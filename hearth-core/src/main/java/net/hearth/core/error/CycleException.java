package net.hearth.core.error;

import java.util.List;

public final class CycleException extends WarmingException {
    private final List<String> path;

    public CycleException(List<String> path) {
        super("Dependency cycle: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    /** Ids along the cycle; the first id is repeated at the end. */
    public List<String> path() { return path; }
}
