package co.fanki.importgraph.analysis.domain;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The module dependency graph of one analysis run.
 *
 * <p>Language-agnostic and keyed by root-relative paths: nodes are
 * module identities, not object references, so import cycles are plain
 * data. Holds the forward adjacency (file to the files it imports) and
 * its exact transpose (file to the files importing it), together with
 * the per-file import edges and exports the analyzers need.</p>
 *
 * <p>Instances are created by {@link DependencyGraphBuilder} and are
 * read-only: every accessor returns an unmodifiable view, so analyzers
 * may share one graph across threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyGraph {

    /** Every discovered module, sorted. */
    private final Set<String> nodes;

    /** file -> files it imports. */
    private final Map<String, Set<String>> forward;

    /** file -> files that import it. */
    private final Map<String, Set<String>> reverse;

    /** file -> its resolved edges, in source order. */
    private final Map<String, List<ImportEdge>> outgoing;

    /** file -> resolved edges pointing at it. */
    private final Map<String, List<ImportEdge>> incoming;

    /** file -> its exports, in source order. */
    private final Map<String, List<ExportedSymbol>> exports;

    /** file -> identifier words written in it. */
    private final Map<String, Set<String>> words;

    private final List<ImportEdge> unresolved;

    private final List<String> skippedFiles;

    DependencyGraph(
            final Set<String> theNodes,
            final Map<String, Set<String>> theForward,
            final Map<String, Set<String>> theReverse,
            final Map<String, List<ImportEdge>> theOutgoing,
            final Map<String, List<ImportEdge>> theIncoming,
            final Map<String, List<ExportedSymbol>> theExports,
            final Map<String, Set<String>> theWords,
            final List<ImportEdge> theUnresolved,
            final List<String> theSkippedFiles) {
        this.nodes = theNodes;
        this.forward = theForward;
        this.reverse = theReverse;
        this.outgoing = theOutgoing;
        this.incoming = theIncoming;
        this.exports = theExports;
        this.words = theWords;
        this.unresolved = theUnresolved;
        this.skippedFiles = theSkippedFiles;
    }

    /**
     * Returns every module in the graph, including those without edges.
     *
     * @return unmodifiable sorted set of module paths
     */
    public Set<String> files() {
        return nodes;
    }

    /**
     * Checks whether the module was discovered.
     *
     * @param file the module path
     * @return true if the module is a node of this graph
     */
    public boolean contains(final String file) {
        return file != null && nodes.contains(file);
    }

    /**
     * Returns the modules imported by the given module.
     *
     * @param file the importing module
     * @return unmodifiable set of imported modules, empty if unknown
     */
    public Set<String> dependencies(final String file) {
        return forward.getOrDefault(file, Set.of());
    }

    /**
     * Returns the modules importing the given module.
     *
     * @param file the imported module
     * @return unmodifiable set of importers, empty if unknown
     */
    public Set<String> dependents(final String file) {
        return reverse.getOrDefault(file, Set.of());
    }

    /**
     * Returns the forward adjacency map.
     *
     * @return unmodifiable map of file to imported files
     */
    public Map<String, Set<String>> forward() {
        return forward;
    }

    /**
     * Returns the reverse adjacency map, the transpose of
     * {@link #forward()}.
     *
     * @return unmodifiable map of file to importing files
     */
    public Map<String, Set<String>> reverse() {
        return reverse;
    }

    /**
     * Returns the resolved import edges written in a module.
     *
     * @param file the importing module
     * @return the edges in source order
     */
    public List<ImportEdge> importsOf(final String file) {
        return outgoing.getOrDefault(file, List.of());
    }

    /**
     * Returns the resolved import edges that point at a module.
     *
     * @param file the imported module
     * @return the edges, grouped by importer
     */
    public List<ImportEdge> importersOf(final String file) {
        return incoming.getOrDefault(file, List.of());
    }

    /**
     * Returns the exports declared or forwarded by a module.
     *
     * @param file the module
     * @return the exported symbols in source order
     */
    public List<ExportedSymbol> exportsOf(final String file) {
        return exports.getOrDefault(file, List.of());
    }

    /**
     * Checks whether a name is written as a whole word in any module other
     * than the given one.
     *
     * @param name the identifier to look for
     * @param owner the module to leave out
     * @return true if another module mentions the name
     */
    public boolean isMentionedOutside(final String name, final String owner) {
        for (final Map.Entry<String, Set<String>> entry : words.entrySet()) {
            if (!entry.getKey().equals(owner)
                    && entry.getValue().contains(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the edges that could not be mapped to a discovered module,
     * package imports included.
     *
     * @return unmodifiable list of unresolved edges
     */
    public List<ImportEdge> unresolvedEdges() {
        return unresolved;
    }

    /**
     * Returns the modules that were discovered but could not be read.
     *
     * @return unmodifiable list of module paths
     */
    public List<String> skippedFiles() {
        return skippedFiles;
    }

    /**
     * Returns the number of modules.
     *
     * @return the node count
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the number of distinct module-to-module dependencies.
     *
     * @return the edge count of the forward graph
     */
    public int edgeCount() {
        int count = 0;
        for (final Set<String> targets : forward.values()) {
            count += targets.size();
        }
        return count;
    }

    static <K, V> Map<K, V> freeze(final Map<K, V> map) {
        return Collections.unmodifiableMap(map);
    }

}
