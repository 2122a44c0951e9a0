package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.DomainException;
import co.fanki.importgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds a {@link DependencyGraph} from a source tree.
 *
 * <p>Runs the whole pipeline: discovery, extraction, resolution and graph
 * building. Files are read and extracted on a fixed worker pool, each
 * file independently; results land in a concurrent map keyed by module
 * path. Resolution only starts once every worker finished, since it needs
 * the full set of discovered modules.</p>
 *
 * <p>Nothing is cached: each call re-reads the tree.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ModuleGraphParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            ModuleGraphParser.class);

    private final ModuleDiscovery discovery;

    private final ModuleExtractor extractor;

    private final int threads;

    /**
     * Creates a parser.
     *
     * @param theDiscovery the file discovery
     * @param theExtractor the per-file import/export extractor
     * @param theThreads the number of extraction workers
     */
    public ModuleGraphParser(final ModuleDiscovery theDiscovery,
            final ModuleExtractor theExtractor, final int theThreads) {
        this.discovery = Preconditions.requireNonNull(theDiscovery,
                "Discovery is required");
        this.extractor = Preconditions.requireNonNull(theExtractor,
                "Extractor is required");
        this.threads = Preconditions.requirePositive(theThreads,
                "Thread count must be positive");
    }

    /**
     * Parses the tree under the root into a dependency graph.
     *
     * @param root the analysis root directory
     * @return the built graph
     * @throws DomainException if the root cannot be walked
     */
    public DependencyGraph parse(final Path root) {
        Preconditions.requireNonNull(root, "Analysis root is required");

        LOG.info("Parsing module graph from: {}", root);

        final List<Path> files = discovery.discover(root);
        LOG.info("Discovered {} module files", files.size());

        final Map<String, FileAnalysis> analyses = new ConcurrentHashMap<>();
        final Set<String> skipped = ConcurrentHashMap.newKeySet();
        extractAll(root, files, analyses, skipped);

        final DependencyGraphBuilder builder = new DependencyGraphBuilder();
        final Set<String> known = new LinkedHashSet<>();

        // Add all nodes first
        for (final Path file : files) {
            final String relative = ModulePaths.relativize(root, file);
            known.add(relative);
            builder.addNode(relative);
        }

        final ModuleResolver resolver = new ModuleResolver(known);
        for (final String relative : known) {
            final FileAnalysis analysis = analyses.get(relative);
            if (analysis != null) {
                builder.addAnalysis(analysis, resolver);
            } else if (skipped.contains(relative)) {
                builder.markSkipped(relative);
            }
        }

        final DependencyGraph graph = builder.build();

        LOG.info("Module graph built: {} nodes, {} edges, {} unresolved"
                        + " imports, {} skipped files",
                graph.nodeCount(), graph.edgeCount(),
                graph.unresolvedEdges().size(),
                graph.skippedFiles().size());

        return graph;
    }

    private void extractAll(final Path root, final List<Path> files,
            final Map<String, FileAnalysis> analyses,
            final Set<String> skipped) {

        if (files.isEmpty()) {
            return;
        }

        final ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(threads, files.size()));
        try {
            final List<Future<?>> futures = new ArrayList<>(files.size());
            for (final Path file : files) {
                futures.add(executor.submit(() ->
                        extractOne(root, file, analyses, skipped)));
            }
            for (final Future<?> future : futures) {
                future.get();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DomainException("Extraction interrupted",
                    DomainException.EXTRACTION_FAILED, e);
        } catch (final ExecutionException e) {
            throw new DomainException("Extraction failed: "
                    + e.getCause().getMessage(),
                    DomainException.EXTRACTION_FAILED, e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private void extractOne(final Path root, final Path file,
            final Map<String, FileAnalysis> analyses,
            final Set<String> skipped) {

        final String relative = ModulePaths.relativize(root, file);
        final String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            LOG.warn("Skipping unreadable module {}: {}", relative,
                    e.toString());
            skipped.add(relative);
            return;
        }

        final ModuleFile module = new ModuleFile(file, relative, content);
        analyses.put(relative, extractor.extract(module));
    }

}
