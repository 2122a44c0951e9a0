package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.analysis.domain.CouplingReport.CouplingIssue;
import co.fanki.importgraph.analysis.domain.CouplingReport.Hotspot;
import co.fanki.importgraph.analysis.domain.CouplingReport.IssueType;
import co.fanki.importgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Reports hotspots and fan-in/fan-out outliers of a graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CouplingAnalyzer {

    /**
     * Analyzes module coupling.
     *
     * @param graph the dependency graph
     * @param threshold the fan-in/fan-out count above which a module is
     *                  reported
     * @param hotspotLimit the maximum number of hotspots to report
     * @return the coupling report
     */
    public CouplingReport analyze(final DependencyGraph graph,
            final int threshold, final int hotspotLimit) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requirePositive(threshold,
                "Threshold must be positive");
        Preconditions.requirePositive(hotspotLimit,
                "Hotspot limit must be positive");

        final List<Hotspot> hotspots = new ArrayList<>();
        final List<CouplingIssue> issues = new ArrayList<>();

        for (final String file : graph.files()) {
            final Set<String> importers = graph.dependents(file);
            final Set<String> imports = graph.dependencies(file);

            if (!importers.isEmpty()) {
                hotspots.add(new Hotspot(file, importers.size()));
            }
            if (imports.size() > threshold) {
                issues.add(new CouplingIssue(IssueType.HIGH_FAN_OUT, file,
                        imports.size(), List.copyOf(imports)));
            }
            if (importers.size() > threshold) {
                issues.add(new CouplingIssue(IssueType.HIGH_FAN_IN, file,
                        importers.size(), List.copyOf(importers)));
            }
        }

        hotspots.sort(Comparator.comparingInt(Hotspot::importers).reversed()
                .thenComparing(Hotspot::file));

        return new CouplingReport(threshold,
                hotspots.subList(0, Math.min(hotspotLimit, hotspots.size())),
                issues);
    }

}
