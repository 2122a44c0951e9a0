package co.fanki.importgraph.analysis.domain;

import java.util.List;

/**
 * The most imported modules of a tree and the modules whose fan-in or
 * fan-out exceeds a threshold.
 *
 * @param threshold the fan-in/fan-out limit used
 * @param hotspots modules ordered by importer count, most imported first
 * @param issues modules above the threshold
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CouplingReport(
        int threshold,
        List<Hotspot> hotspots,
        List<CouplingIssue> issues
) {

    public CouplingReport {
        hotspots = hotspots == null ? List.of() : List.copyOf(hotspots);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * A heavily imported module.
     *
     * @param file the module path
     * @param importers how many modules import it
     */
    public record Hotspot(String file, int importers) {}

    /**
     * What kind of coupling a module shows.
     */
    public enum IssueType {

        /** The module imports too many modules. */
        HIGH_FAN_OUT,

        /** Too many modules import the module. */
        HIGH_FAN_IN
    }

    /**
     * A module above the coupling threshold.
     *
     * @param type fan-in or fan-out
     * @param file the module path
     * @param count the number of related modules
     * @param relatedFiles the imported (fan-out) or importing (fan-in)
     *                     modules
     */
    public record CouplingIssue(
            IssueType type,
            String file,
            int count,
            List<String> relatedFiles
    ) {}

}
