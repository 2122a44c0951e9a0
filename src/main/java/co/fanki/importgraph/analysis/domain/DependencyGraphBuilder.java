package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Accumulates modules and edges and produces an immutable
 * {@link DependencyGraph}.
 *
 * <p>Every resolved edge {@code A -> B} is recorded in one step as
 * {@code B} in {@code forward[A]} and {@code A} in {@code reverse[B]};
 * there is no other way to add adjacency, which keeps the two maps exact
 * transposes. Unresolved edges are kept aside for diagnostics and never
 * enter the adjacency maps.</p>
 *
 * <p>Not thread-safe: feed it from a single thread once extraction has
 * finished.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DependencyGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            DependencyGraphBuilder.class);

    private final Set<String> nodes = new TreeSet<>();

    private final Map<String, Set<String>> forward = new LinkedHashMap<>();

    private final Map<String, Set<String>> reverse = new LinkedHashMap<>();

    private final Map<String, List<ImportEdge>> outgoing =
            new LinkedHashMap<>();

    private final Map<String, List<ImportEdge>> incoming =
            new LinkedHashMap<>();

    private final Map<String, List<ExportedSymbol>> exports =
            new LinkedHashMap<>();

    private final Map<String, Set<String>> words = new LinkedHashMap<>();

    private final List<ImportEdge> unresolved = new ArrayList<>();

    private final List<String> skipped = new ArrayList<>();

    /**
     * Adds a module node.
     *
     * @param file the module path
     * @return this builder
     */
    public DependencyGraphBuilder addNode(final String file) {
        Preconditions.requireNonBlank(file, "File is required");
        nodes.add(file);
        return this;
    }

    /**
     * Adds a dependency between two known modules, updating both maps.
     *
     * <p>Dependencies that reference an unknown module are ignored, as
     * they cannot be part of the graph.</p>
     *
     * @param from the importing module
     * @param to the imported module
     * @return this builder
     */
    public DependencyGraphBuilder addDependency(final String from,
            final String to) {
        Preconditions.requireNonBlank(from, "From is required");
        Preconditions.requireNonBlank(to, "To is required");

        if (!nodes.contains(from) || !nodes.contains(to)) {
            LOG.debug("Ignoring dependency with unknown end: {} -> {}",
                    from, to);
            return this;
        }

        forward.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        reverse.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
        return this;
    }

    /**
     * Adds the edges and exports extracted from one module, resolving
     * each edge with the given resolver.
     *
     * @param analysis the extraction result
     * @param resolver the resolver over the discovered modules
     * @return this builder
     */
    public DependencyGraphBuilder addAnalysis(final FileAnalysis analysis,
            final ModuleResolver resolver) {
        Preconditions.requireNonNull(analysis, "Analysis is required");
        Preconditions.requireNonNull(resolver, "Resolver is required");

        addNode(analysis.file());

        for (final ImportEdge raw : analysis.imports()) {
            addEdge(resolver.resolve(raw));
        }
        if (!analysis.exports().isEmpty()) {
            exports.computeIfAbsent(analysis.file(), k -> new ArrayList<>())
                    .addAll(analysis.exports());
        }
        if (!analysis.identifiers().isEmpty()) {
            words.put(analysis.file(), analysis.identifiers());
        }
        return this;
    }

    /**
     * Adds an edge, already run through the resolver.
     *
     * @param edge the edge
     * @return this builder
     */
    public DependencyGraphBuilder addEdge(final ImportEdge edge) {
        Preconditions.requireNonNull(edge, "Edge is required");

        if (!edge.isResolved() || !nodes.contains(edge.target())) {
            if (edge.isRelative()) {
                LOG.debug("Unresolved import '{}' in {}", edge.specifier(),
                        edge.file());
            }
            unresolved.add(edge);
            return this;
        }

        addDependency(edge.file(), edge.target());
        outgoing.computeIfAbsent(edge.file(), k -> new ArrayList<>())
                .add(edge);
        incoming.computeIfAbsent(edge.target(), k -> new ArrayList<>())
                .add(edge);
        return this;
    }

    /**
     * Records a module that was discovered but could not be read. It
     * stays a node so that its importers still resolve.
     *
     * @param file the module path
     * @return this builder
     */
    public DependencyGraphBuilder markSkipped(final String file) {
        addNode(file);
        skipped.add(file);
        return this;
    }

    /**
     * Builds the immutable graph.
     *
     * @return the dependency graph
     */
    public DependencyGraph build() {
        return new DependencyGraph(
                Collections.unmodifiableSet(new TreeSet<>(nodes)),
                DependencyGraph.freeze(copySets(forward)),
                DependencyGraph.freeze(copySets(reverse)),
                DependencyGraph.freeze(copyLists(outgoing)),
                DependencyGraph.freeze(copyLists(incoming)),
                DependencyGraph.freeze(copyLists(exports)),
                DependencyGraph.freeze(new LinkedHashMap<>(words)),
                List.copyOf(unresolved),
                List.copyOf(skipped));
    }

    private static Map<String, Set<String>> copySets(
            final Map<String, Set<String>> source) {
        final Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (final Map.Entry<String, Set<String>> entry : source.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(
                    new LinkedHashSet<>(entry.getValue())));
        }
        return copy;
    }

    private static <T> Map<String, List<T>> copyLists(
            final Map<String, List<T>> source) {
        final Map<String, List<T>> copy = new LinkedHashMap<>();
        for (final Map.Entry<String, List<T>> entry : source.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return copy;
    }

}
