package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.Preconditions;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A circular import chain.
 *
 * <p>The path starts and ends at the same module and every consecutive
 * pair is a forward edge. A module importing itself is {@code [a, a]}.</p>
 *
 * @param path the closed path of module paths
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Cycle(List<String> path) {

    public Cycle {
        Preconditions.requireNonNull(path, "Cycle path is required");
        Preconditions.require(path.size() >= 2,
                "A cycle needs at least two path entries");
        Preconditions.require(path.get(0).equals(path.get(path.size() - 1)),
                "A cycle must end where it starts");
        path = List.copyOf(path);
    }

    /**
     * Returns the number of edges in the cycle, 1 for a self import.
     *
     * @return the cycle length
     */
    public int length() {
        return path.size() - 1;
    }

    /**
     * Returns the distinct modules taking part in the cycle.
     *
     * @return sorted set of module paths
     */
    public Set<String> modules() {
        return new TreeSet<>(path.subList(0, path.size() - 1));
    }

    /**
     * Whether this is a module importing itself.
     *
     * @return true for cycles of length 1
     */
    public boolean isSelfImport() {
        return length() == 1;
    }

    /**
     * Renders the cycle as {@code a -> b -> a}.
     *
     * @return the arrow-joined path
     */
    public String describe() {
        return String.join(" -> ", path);
    }

}
