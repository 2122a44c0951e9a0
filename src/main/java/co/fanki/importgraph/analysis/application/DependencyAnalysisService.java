package co.fanki.importgraph.analysis.application;

import co.fanki.importgraph.analysis.domain.CouplingAnalyzer;
import co.fanki.importgraph.analysis.domain.CouplingReport;
import co.fanki.importgraph.analysis.domain.Cycle;
import co.fanki.importgraph.analysis.domain.CycleDetector;
import co.fanki.importgraph.analysis.domain.DeadExport;
import co.fanki.importgraph.analysis.domain.DeadExportDetector;
import co.fanki.importgraph.analysis.domain.DependencyGraph;
import co.fanki.importgraph.analysis.domain.ImpactAnalyzer;
import co.fanki.importgraph.analysis.domain.ImpactClassification;
import co.fanki.importgraph.analysis.domain.ImpactReport;
import co.fanki.importgraph.analysis.domain.ImportEdge;
import co.fanki.importgraph.analysis.domain.ModuleDiscovery;
import co.fanki.importgraph.analysis.domain.ModuleGraphParser;
import co.fanki.importgraph.analysis.domain.ModulePaths;
import co.fanki.importgraph.analysis.domain.PatternModuleExtractor;
import co.fanki.importgraph.shared.DomainException;
import co.fanki.importgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs dependency analyses against a source tree on disk.
 *
 * <p>Every call validates its input, rebuilds the module graph from
 * scratch and runs one analysis on it. Invalid roots and unknown targets
 * fail with a {@link DomainException} before any graph is built.</p>
 *
 * <p>Results are plain records meant for JSON serialization by the REST
 * controller and the MCP tools.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class DependencyAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DependencyAnalysisService.class);

    private final ModuleGraphParser parser;

    private final CycleDetector cycleDetector;

    private final ImpactAnalyzer impactAnalyzer;

    private final DeadExportDetector deadExportDetector;

    private final CouplingAnalyzer couplingAnalyzer;

    private final int couplingThreshold;

    private final int hotspotLimit;

    /**
     * Creates the service with the default analyzers.
     *
     * @param theThreads the number of extraction workers, 0 for one per
     *                   processor
     * @param theCouplingThreshold the fan-in/fan-out limit
     * @param theHotspotLimit the number of hotspots to report
     */
    @Autowired
    public DependencyAnalysisService(
            @Value("${importgraph.extraction.threads:0}") final int theThreads,
            @Value("${importgraph.coupling.threshold:10}")
            final int theCouplingThreshold,
            @Value("${importgraph.coupling.hotspots:10}")
            final int theHotspotLimit) {
        this(new ModuleGraphParser(
                        new ModuleDiscovery(), new PatternModuleExtractor(),
                        theThreads > 0 ? theThreads
                                : Runtime.getRuntime().availableProcessors()),
                new CycleDetector(), new ImpactAnalyzer(),
                new DeadExportDetector(), new CouplingAnalyzer(),
                theCouplingThreshold, theHotspotLimit);
    }

    /**
     * Creates the service with explicit collaborators.
     *
     * @param theParser the module graph parser
     * @param theCycleDetector the cycle detector
     * @param theImpactAnalyzer the blast radius analyzer
     * @param theDeadExportDetector the dead export detector
     * @param theCouplingAnalyzer the coupling analyzer
     * @param theCouplingThreshold the fan-in/fan-out limit
     * @param theHotspotLimit the number of hotspots to report
     */
    public DependencyAnalysisService(
            final ModuleGraphParser theParser,
            final CycleDetector theCycleDetector,
            final ImpactAnalyzer theImpactAnalyzer,
            final DeadExportDetector theDeadExportDetector,
            final CouplingAnalyzer theCouplingAnalyzer,
            final int theCouplingThreshold,
            final int theHotspotLimit) {
        this.parser = Preconditions.requireNonNull(theParser,
                "Parser is required");
        this.cycleDetector = Preconditions.requireNonNull(theCycleDetector,
                "Cycle detector is required");
        this.impactAnalyzer = Preconditions.requireNonNull(theImpactAnalyzer,
                "Impact analyzer is required");
        this.deadExportDetector = Preconditions.requireNonNull(
                theDeadExportDetector, "Dead export detector is required");
        this.couplingAnalyzer = Preconditions.requireNonNull(
                theCouplingAnalyzer, "Coupling analyzer is required");
        this.couplingThreshold = Preconditions.requirePositive(
                theCouplingThreshold, "Coupling threshold must be positive");
        this.hotspotLimit = Preconditions.requirePositive(theHotspotLimit,
                "Hotspot limit must be positive");
    }

    /**
     * Builds the module graph of a tree.
     *
     * @param root the analysis root directory
     * @return the graph overview
     */
    public GraphOverview graph(final String root) {
        return graph(root, null);
    }

    /**
     * Builds the module graph of a tree, keeping only the dependencies
     * where either end contains the focus text.
     *
     * @param root the analysis root directory
     * @param focus a path fragment to filter dependencies by, null or blank
     *              to keep them all
     * @return the graph overview
     */
    public GraphOverview graph(final String root, final String focus) {
        final Path rootPath = resolveRoot(root);
        final DependencyGraph graph = parser.parse(rootPath);
        final String fragment = focus == null || focus.isBlank()
                ? null : focus.trim();

        final List<UnresolvedImport> unresolved = new ArrayList<>();
        for (final ImportEdge edge : graph.unresolvedEdges()) {
            if (edge.isRelative()) {
                unresolved.add(new UnresolvedImport(edge.file(),
                        edge.specifier(), edge.kind().name(),
                        edge.displaySymbols()));
            }
        }

        final Map<String, List<String>> forward = sortedCopy(graph.forward(),
                fragment);
        int edges = 0;
        for (final List<String> targets : forward.values()) {
            edges += targets.size();
        }

        return new GraphOverview(rootPath.toString(), fragment,
                graph.nodeCount(), edges, forward,
                sortedCopy(graph.reverse(), fragment), unresolved,
                graph.skippedFiles());
    }

    /**
     * Finds the import cycles of a tree.
     *
     * @param root the analysis root directory
     * @return the cycle report
     */
    public CycleReport cycles(final String root) {
        final Path rootPath = resolveRoot(root);
        final DependencyGraph graph = parser.parse(rootPath);
        final List<Cycle> cycles = cycleDetector.detect(graph);

        final List<List<String>> paths = new ArrayList<>();
        for (final Cycle cycle : cycles) {
            paths.add(cycle.path());
        }
        return new CycleReport(rootPath.toString(), graph.nodeCount(),
                !paths.isEmpty(), paths);
    }

    /**
     * Computes the blast radius of a module.
     *
     * @param root the analysis root directory
     * @param target the module, absolute or relative to the root
     * @param maxDepth the deepest level to report, null for unbounded
     * @return the blast radius
     */
    public BlastRadius blastRadius(final String root, final String target,
            final Integer maxDepth) {
        Preconditions.requireDomain(maxDepth == null || maxDepth > 0,
                "Max depth must be positive", DomainException.INVALID_ARGUMENT);
        final Path rootPath = resolveRoot(root);
        final String relativeTarget = resolveTarget(rootPath, target);

        final DependencyGraph graph = parser.parse(rootPath);
        final ImpactReport report = impactAnalyzer.analyze(graph,
                relativeTarget,
                maxDepth == null ? Integer.MAX_VALUE : maxDepth);

        final ImpactClassification classification = report.classification();
        return new BlastRadius(report.target(), report.totalAffected(),
                classification.name().toLowerCase(),
                classification.guidance(), report.depths(),
                report.directImporters(), report.indirectConsumers(),
                report.entryPointsReached());
    }

    /**
     * Finds exports that nothing in the tree imports.
     *
     * @param root the analysis root directory
     * @param ignoreGlob a file name glob to leave out, may be null
     * @return the dead export report
     */
    public DeadExportReport deadExports(final String root,
            final String ignoreGlob) {
        final Path rootPath = resolveRoot(root);
        final DependencyGraph graph = parser.parse(rootPath);
        final List<DeadExport> dead = deadExportDetector.detect(graph,
                ignoreGlob);

        int totalExports = 0;
        for (final String file : graph.files()) {
            totalExports += graph.exportsOf(file).size();
        }
        return new DeadExportReport(rootPath.toString(), graph.nodeCount(),
                totalExports, dead.size(), dead);
    }

    /**
     * Reports hotspots and coupling outliers of a tree.
     *
     * @param root the analysis root directory
     * @return the coupling report
     */
    public CouplingReport coupling(final String root) {
        final Path rootPath = resolveRoot(root);
        return couplingAnalyzer.analyze(parser.parse(rootPath),
                couplingThreshold, hotspotLimit);
    }

    private Path resolveRoot(final String root) {
        Preconditions.requireDomain(root != null && !root.isBlank(),
                "Analysis root is required", DomainException.ROOT_NOT_FOUND);
        try {
            final Path path = Path.of(root).toAbsolutePath().normalize();
            if (!Files.isDirectory(path) || !Files.isReadable(path)) {
                throw new DomainException(
                        "Analysis root is not a readable directory: " + root,
                        DomainException.ROOT_NOT_FOUND);
            }
            return path.toRealPath();
        } catch (final InvalidPathException | IOException e) {
            throw new DomainException("Invalid analysis root: " + root,
                    DomainException.ROOT_NOT_FOUND, e);
        }
    }

    private String resolveTarget(final Path rootPath, final String target) {
        Preconditions.requireDomain(target != null && !target.isBlank(),
                "Target file is required", DomainException.TARGET_NOT_FOUND);
        try {
            Path path = Path.of(target);
            if (!path.isAbsolute()) {
                path = rootPath.resolve(path);
            }
            if (!Files.isRegularFile(path)) {
                throw new DomainException("Target is not a file: " + target,
                        DomainException.TARGET_NOT_FOUND);
            }
            final Path real = path.toRealPath();
            if (!real.startsWith(rootPath)) {
                throw new DomainException(
                        "Target is outside the analysis root: " + target,
                        DomainException.TARGET_NOT_FOUND);
            }
            if (!ModuleDiscovery.isDiscoverable(rootPath.relativize(real))) {
                throw new DomainException(
                        "Target is not an analyzed module: " + target,
                        DomainException.TARGET_NOT_FOUND);
            }
            final String relative = ModulePaths.relativize(rootPath, real);
            LOG.debug("Resolved target {} to {}", target, relative);
            return relative;
        } catch (final InvalidPathException | IOException e) {
            throw new DomainException("Invalid target: " + target,
                    DomainException.TARGET_NOT_FOUND, e);
        }
    }

    private static Map<String, List<String>> sortedCopy(
            final Map<String, Set<String>> adjacency, final String focus) {
        final Map<String, List<String>> copy = new LinkedHashMap<>();
        adjacency.keySet().stream().sorted().forEach(key -> {
            final List<String> ends = adjacency.get(key).stream()
                    .filter(end -> focus == null || key.contains(focus)
                            || end.contains(focus))
                    .sorted()
                    .toList();
            if (!ends.isEmpty()) {
                copy.put(key, ends);
            }
        });
        return copy;
    }

    /**
     * Module graph of a tree.
     *
     * @param root the analyzed root
     * @param focus the path fragment dependencies were filtered by, null
     *              when unfiltered
     * @param totalFiles the number of modules
     * @param totalEdges the number of module dependencies reported
     * @param graph module to the modules it imports
     * @param reverseGraph module to the modules importing it
     * @param unresolvedImports relative imports with no matching module
     * @param skippedFiles modules that could not be read
     */
    public record GraphOverview(
            String root,
            String focus,
            int totalFiles,
            int totalEdges,
            Map<String, List<String>> graph,
            Map<String, List<String>> reverseGraph,
            List<UnresolvedImport> unresolvedImports,
            List<String> skippedFiles) {}

    /**
     * A relative import that matched no module.
     *
     * @param file the importing module
     * @param specifier the specifier as written
     * @param kind the import form
     * @param symbols the imported names, or a placeholder for namespace
     *                and dynamic forms
     */
    public record UnresolvedImport(String file, String specifier,
            String kind, List<String> symbols) {}

    /**
     * Import cycles of a tree.
     *
     * @param root the analyzed root
     * @param totalFiles the number of modules
     * @param hasCycles whether any cycle was found
     * @param cycles the closed cycle paths
     */
    public record CycleReport(
            String root,
            int totalFiles,
            boolean hasCycles,
            List<List<String>> cycles) {}

    /**
     * Blast radius of a module.
     *
     * @param target the analyzed module
     * @param totalAffected the number of affected modules
     * @param classification narrow, medium or wide
     * @param guidance the risk guidance for the classification
     * @param depths affected module to import hops from the target
     * @param directImporters the depth-1 modules
     * @param indirectConsumers the deeper modules
     * @param entryPointsReached the affected entry points
     */
    public record BlastRadius(
            String target,
            int totalAffected,
            String classification,
            String guidance,
            Map<String, Integer> depths,
            List<String> directImporters,
            List<String> indirectConsumers,
            List<String> entryPointsReached) {}

    /**
     * Dead exports of a tree.
     *
     * @param root the analyzed root
     * @param totalFiles the number of modules
     * @param totalExports the number of exports found
     * @param deadCount the number of dead exports
     * @param deadExports the dead exports, high confidence first
     */
    public record DeadExportReport(
            String root,
            int totalFiles,
            int totalExports,
            int deadCount,
            List<DeadExport> deadExports) {}

}
