package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Flags exported symbols that no other module imports.
 *
 * <p>The detector prefers missing a dead export over flagging a live one.
 * A symbol declared in module {@code F} is considered used when:</p>
 * <ul>
 *   <li>any other module imports {@code F} through a namespace, dynamic,
 *       require or {@code export *} form, since those can reach any
 *       export without naming it;</li>
 *   <li>another module imports it by name (or, for the default export,
 *       through a default import);</li>
 *   <li>a barrel re-exports it and the re-exported name is used from the
 *       barrel by these same rules, or the barrel is itself an entry
 *       point;</li>
 *   <li>any other module imports or re-exports that name, whatever the
 *       specifier resolved to, since path aliases and package mappings
 *       are not resolved;</li>
 *   <li>the name is written as a whole word anywhere in another
 *       module.</li>
 * </ul>
 *
 * <p>Re-exported symbols are never reported themselves; their usage is
 * charged to the module that declares them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DeadExportDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            DeadExportDetector.class);

    private static final String DEFAULT_NAME = "default";

    /**
     * Finds the dead exports of every module.
     *
     * @param graph the dependency graph
     * @return the dead exports, high confidence first
     */
    public List<DeadExport> detect(final DependencyGraph graph) {
        return detect(graph, null);
    }

    /**
     * Finds the dead exports, skipping modules whose file name matches a
     * glob.
     *
     * @param graph the dependency graph
     * @param ignoreGlob a file name glob where {@code *} matches anything,
     *                   null or blank to scan every module
     * @return the dead exports, high confidence first
     */
    public List<DeadExport> detect(final DependencyGraph graph,
            final String ignoreGlob) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final Pattern ignore = toPattern(ignoreGlob);
        final Map<String, Set<String>> requesters = requesters(graph);
        final List<DeadExport> dead = new ArrayList<>();
        int scanned = 0;

        for (final String file : graph.files()) {
            if (ignore != null && ignore.matcher(
                    ModulePaths.fileName(file)).matches()) {
                continue;
            }
            for (final ExportedSymbol symbol : graph.exportsOf(file)) {
                if (symbol.reExport()) {
                    continue;
                }
                scanned++;
                if (isUsed(graph, file, symbol.name(), symbol.kind(),
                        new HashSet<>())
                        || isReferencedByName(graph, requesters, file,
                                symbol.name())) {
                    continue;
                }
                dead.add(toDeadExport(symbol));
            }
        }

        dead.sort(Comparator.comparing(DeadExport::confidence));

        LOG.info("Dead export scan: {} of {} exports have no importer",
                dead.size(), scanned);
        return dead;
    }

    private boolean isUsed(final DependencyGraph graph, final String file,
            final String name, final ExportKind kind,
            final Set<String> visited) {

        if (!visited.add(file + "#" + name)) {
            return false;
        }

        for (final ImportEdge edge : graph.importersOf(file)) {
            if (edge.file().equals(file)) {
                continue;
            }
            if (edge.isOpaque()) {
                return true;
            }
            switch (edge.kind()) {
                case DEFAULT -> {
                    if (kind == ExportKind.DEFAULT) {
                        return true;
                    }
                }
                case NAMED -> {
                    for (int i = 0; i < edge.symbols().size(); i++) {
                        if (matches(edge.importedNames().get(i), name, kind)
                                || name.equals(edge.symbols().get(i))) {
                            return true;
                        }
                    }
                }
                case RE_EXPORT -> {
                    for (int i = 0; i < edge.symbols().size(); i++) {
                        if (!matches(edge.importedNames().get(i), name,
                                kind)) {
                            continue;
                        }
                        if (EntryPointHeuristic.isEntryPoint(edge.file())) {
                            return true;
                        }
                        final String alias = edge.symbols().get(i);
                        final ExportKind aliasKind = DEFAULT_NAME.equals(alias)
                                ? ExportKind.DEFAULT : ExportKind.NAMED;
                        if (isUsed(graph, edge.file(), alias, aliasKind,
                                visited)) {
                            return true;
                        }
                    }
                }
                default -> {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean matches(final String importedName,
            final String name, final ExportKind kind) {
        if (kind == ExportKind.DEFAULT && DEFAULT_NAME.equals(importedName)) {
            return true;
        }
        return name.equals(importedName);
    }

    /**
     * Name based fallback: anonymous default exports are left to the
     * structural rules, as the word "default" says nothing about them.
     */
    private static boolean isReferencedByName(final DependencyGraph graph,
            final Map<String, Set<String>> requesters, final String file,
            final String name) {
        if (DEFAULT_NAME.equals(name)) {
            return false;
        }
        for (final String requester : requesters.getOrDefault(name,
                Set.of())) {
            if (!requester.equals(file)) {
                return true;
            }
        }
        return graph.isMentionedOutside(name, file);
    }

    /**
     * Maps every name requested by a named, default or re-export edge,
     * resolved or not, to the modules requesting it.
     */
    private static Map<String, Set<String>> requesters(
            final DependencyGraph graph) {
        final List<ImportEdge> edges = new ArrayList<>(
                graph.unresolvedEdges());
        for (final String file : graph.files()) {
            edges.addAll(graph.importsOf(file));
        }

        final Map<String, Set<String>> requesters = new HashMap<>();
        for (final ImportEdge edge : edges) {
            if (!edge.kind().isSymbolic()) {
                continue;
            }
            for (int i = 0; i < edge.symbols().size(); i++) {
                requesters.computeIfAbsent(edge.importedNames().get(i),
                        k -> new HashSet<>()).add(edge.file());
                requesters.computeIfAbsent(edge.symbols().get(i),
                        k -> new HashSet<>()).add(edge.file());
            }
        }
        return requesters;
    }

    private static DeadExport toDeadExport(final ExportedSymbol symbol) {
        final String file = symbol.file();
        if (EntryPointHeuristic.isEntryPoint(file)) {
            return new DeadExport(file, symbol.name(), symbol.kind(),
                    DeadExportConfidence.MEDIUM,
                    "Entry point export, may be used externally");
        }
        if (file.contains(".test.") || file.contains(".spec.")) {
            return new DeadExport(file, symbol.name(), symbol.kind(),
                    DeadExportConfidence.MEDIUM,
                    "Test file export, may be intentional");
        }
        return new DeadExport(file, symbol.name(), symbol.kind(),
                DeadExportConfidence.HIGH,
                "No import or reference found in any other file");
    }

    private static Pattern toPattern(final String glob) {
        if (glob == null || glob.isBlank()) {
            return null;
        }
        final List<String> parts = new ArrayList<>();
        for (final String part : glob.trim().split("\\*", -1)) {
            parts.add(Pattern.quote(part));
        }
        return Pattern.compile(String.join(".*", parts));
    }

}
