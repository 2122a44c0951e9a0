package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.DomainException;
import co.fanki.importgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;

/**
 * Computes the blast radius of a module with a breadth-first search over
 * the reverse graph.
 *
 * <p>The target sits at depth 0 and is not part of the result. Each
 * importer is recorded the first time it is reached, which in BFS order
 * is its shortest distance to the target.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ImpactAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            ImpactAnalyzer.class);

    /**
     * Computes the unbounded blast radius of a module.
     *
     * @param graph the dependency graph
     * @param target the module path
     * @return the impact report
     * @throws DomainException if the target is not in the graph
     */
    public ImpactReport analyze(final DependencyGraph graph,
            final String target) {
        return analyze(graph, target, Integer.MAX_VALUE);
    }

    /**
     * Computes the blast radius of a module, up to a maximum depth.
     *
     * @param graph the dependency graph
     * @param target the module path
     * @param maxDepth the deepest level to report, at least 1
     * @return the impact report
     * @throws DomainException if the target is not in the graph
     */
    public ImpactReport analyze(final DependencyGraph graph,
            final String target, final int maxDepth) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonBlank(target, "Target is required");
        Preconditions.requirePositive(maxDepth, "Max depth must be positive");
        Preconditions.requireDomain(graph.contains(target),
                "Target is not a discovered module: " + target,
                DomainException.TARGET_NOT_FOUND);

        final Map<String, Integer> depths = new LinkedHashMap<>();
        final Queue<String> queue = new ArrayDeque<>();
        queue.add(target);
        depths.put(target, 0);

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            final int depth = depths.get(current);
            if (depth >= maxDepth) {
                continue;
            }
            for (final String importer : graph.dependents(current)) {
                if (!depths.containsKey(importer)) {
                    depths.put(importer, depth + 1);
                    queue.add(importer);
                }
            }
        }
        depths.remove(target);

        boolean entryPointReached = false;
        for (final String file : depths.keySet()) {
            if (EntryPointHeuristic.isEntryPoint(file)) {
                entryPointReached = true;
                break;
            }
        }

        final ImpactClassification classification =
                ImpactClassification.of(depths.size(), entryPointReached);

        LOG.info("Blast radius of {}: {} affected modules, {}", target,
                depths.size(), classification);

        return new ImpactReport(target, depths, classification);
    }

}
