package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The blast radius of a module: every module that transitively imports
 * it, with the number of import hops back to it.
 *
 * @param target the module whose change is analyzed
 * @param depths affected module to BFS depth, 1 for direct importers, in
 *               discovery order
 * @param classification the spread classification
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImpactReport(
        String target,
        Map<String, Integer> depths,
        ImpactClassification classification
) {

    public ImpactReport {
        Preconditions.requireNonBlank(target, "Target is required");
        Preconditions.requireNonNull(classification,
                "Classification is required");
        depths = depths == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(depths));
    }

    /**
     * Returns the number of affected modules, the target excluded.
     *
     * @return the affected count
     */
    public int totalAffected() {
        return depths.size();
    }

    /**
     * Returns the modules importing the target directly.
     *
     * @return the depth-1 modules
     */
    public List<String> directImporters() {
        return atDepth(true);
    }

    /**
     * Returns the modules reaching the target through other modules.
     *
     * @return the modules at depth 2 or more
     */
    public List<String> indirectConsumers() {
        return atDepth(false);
    }

    /**
     * Returns the affected modules that look like entry points.
     *
     * @return the entry points reached
     */
    public List<String> entryPointsReached() {
        final List<String> result = new ArrayList<>();
        for (final String file : depths.keySet()) {
            if (EntryPointHeuristic.isEntryPoint(file)) {
                result.add(file);
            }
        }
        return result;
    }

    /**
     * Returns the depth of an affected module.
     *
     * @param file the module path
     * @return the depth, or null if the module is not affected
     */
    public Integer depthOf(final String file) {
        return depths.get(file);
    }

    private List<String> atDepth(final boolean direct) {
        final List<String> result = new ArrayList<>();
        for (final Map.Entry<String, Integer> entry : depths.entrySet()) {
            if ((entry.getValue() == 1) == direct) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

}
