package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Finds circular imports with a depth-first search over the forward
 * graph.
 *
 * <p>Tracks the modules on the current DFS path and the modules already
 * visited. Reaching a module that is on the path records the path slice
 * from that module onwards as a cycle. Each module not yet visited starts
 * a new search. Cycles are then deduplicated by their module set, so the
 * same loop found from different starting points is reported once.</p>
 *
 * <p>The search keeps its own frame stack instead of recursing, so long
 * import chains cannot exhaust the thread stack.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CycleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            CycleDetector.class);

    /**
     * Detects the import cycles of a graph.
     *
     * @param graph the dependency graph
     * @return the distinct cycles, in discovery order
     */
    public List<Cycle> detect(final DependencyGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final Set<String> visited = new HashSet<>();
        final List<Cycle> found = new ArrayList<>();

        for (final String root : graph.files()) {
            if (!visited.contains(root)) {
                search(graph, root, visited, found);
            }
        }

        final List<Cycle> unique = new ArrayList<>();
        final Set<Set<String>> seen = new HashSet<>();
        for (final Cycle cycle : found) {
            if (seen.add(cycle.modules())) {
                unique.add(cycle);
            }
        }

        LOG.info("Found {} import cycles across {} modules", unique.size(),
                graph.nodeCount());
        return unique;
    }

    private void search(final DependencyGraph graph, final String root,
            final Set<String> visited, final List<Cycle> found) {

        final Deque<Frame> frames = new ArrayDeque<>();
        final List<String> path = new ArrayList<>();
        final Set<String> onPath = new HashSet<>();

        enter(graph, root, frames, path, onPath, visited);

        while (!frames.isEmpty()) {
            final Frame frame = frames.peek();

            if (!frame.dependencies().hasNext()) {
                frames.pop();
                onPath.remove(frame.module());
                path.remove(path.size() - 1);
                continue;
            }

            final String dependency = frame.dependencies().next();
            if (onPath.contains(dependency)) {
                final List<String> loop = new ArrayList<>(
                        path.subList(path.indexOf(dependency), path.size()));
                loop.add(dependency);
                found.add(new Cycle(loop));
            } else if (!visited.contains(dependency)) {
                enter(graph, dependency, frames, path, onPath, visited);
            }
        }
    }

    private void enter(final DependencyGraph graph, final String module,
            final Deque<Frame> frames, final List<String> path,
            final Set<String> onPath, final Set<String> visited) {
        visited.add(module);
        onPath.add(module);
        path.add(module);
        frames.push(new Frame(module,
                graph.dependencies(module).iterator()));
    }

    private record Frame(String module, Iterator<String> dependencies) {}

}
