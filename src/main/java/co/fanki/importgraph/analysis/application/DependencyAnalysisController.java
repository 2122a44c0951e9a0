package co.fanki.importgraph.analysis.application;

import co.fanki.importgraph.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for dependency analyses over a source tree.
 *
 * <p>Each endpoint parses the tree under the requested root and returns
 * one analysis. Invalid roots and targets answer 400 with the error code
 * of the failure.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/analysis")
@Tag(name = "Dependency Analysis",
        description = "Analyze the module import graph of a source tree")
public class DependencyAnalysisController {

    private static final Logger LOG = LoggerFactory.getLogger(
            DependencyAnalysisController.class);

    private final DependencyAnalysisService analysisService;

    /**
     * Creates a new DependencyAnalysisController.
     *
     * @param theAnalysisService the dependency analysis service
     */
    public DependencyAnalysisController(
            final DependencyAnalysisService theAnalysisService) {
        this.analysisService = theAnalysisService;
    }

    /**
     * Builds the module graph.
     *
     * @param request the request with the root directory and optional focus
     * @return the forward and reverse graphs
     */
    @PostMapping("/graph")
    @Operation(summary = "Build the module graph",
            description = "Returns every module with the modules it imports"
                    + " and the modules importing it, plus the relative"
                    + " imports that did not resolve. An optional focus"
                    + " keeps only dependencies touching matching paths.")
    public ResponseEntity<?> graph(@RequestBody final GraphRequest request) {
        LOG.info("Graph request for {} (focus: {})", request.root(),
                request.focus());
        return respond("graph",
                () -> analysisService.graph(request.root(), request.focus()));
    }

    /**
     * Finds import cycles.
     *
     * @param request the request with the root directory
     * @return the detected cycles
     */
    @PostMapping("/cycles")
    @Operation(summary = "Find import cycles",
            description = "Returns every distinct import cycle as a closed"
                    + " path, first module repeated at the end.")
    public ResponseEntity<?> cycles(@RequestBody final RootRequest request) {
        LOG.info("Cycles request for {}", request.root());
        return respond("cycles",
                () -> analysisService.cycles(request.root()));
    }

    /**
     * Computes the blast radius of a module.
     *
     * @param request the request with the root, target and optional depth
     * @return the affected modules and the risk classification
     */
    @PostMapping("/blast-radius")
    @Operation(summary = "Compute the blast radius of a module",
            description = "Returns every module that transitively imports"
                    + " the target, with its distance in import hops."
                    + " Example target: src/utils/format.ts")
    public ResponseEntity<?> blastRadius(
            @RequestBody final BlastRadiusRequest request) {
        LOG.info("Blast radius request for {} in {}", request.target(),
                request.root());
        return respond("blast radius",
                () -> analysisService.blastRadius(request.root(),
                        request.target(), request.maxDepth()));
    }

    /**
     * Finds exports nothing imports.
     *
     * @param request the request with the root and optional ignore glob
     * @return the dead exports
     */
    @PostMapping("/dead-exports")
    @Operation(summary = "Find dead exports",
            description = "Returns exported symbols no other module"
                    + " imports. Conservative: namespace, dynamic and"
                    + " require imports keep every export alive.")
    public ResponseEntity<?> deadExports(
            @RequestBody final DeadExportsRequest request) {
        LOG.info("Dead exports request for {}", request.root());
        return respond("dead exports",
                () -> analysisService.deadExports(request.root(),
                        request.ignorePattern()));
    }

    /**
     * Reports coupling hotspots.
     *
     * @param request the request with the root directory
     * @return the hotspots and the fan-in/fan-out outliers
     */
    @PostMapping("/coupling")
    @Operation(summary = "Report coupling hotspots",
            description = "Returns the most imported modules and the"
                    + " modules whose fan-in or fan-out exceeds the"
                    + " configured threshold.")
    public ResponseEntity<?> coupling(@RequestBody final RootRequest request) {
        LOG.info("Coupling request for {}", request.root());
        return respond("coupling",
                () -> analysisService.coupling(request.root()));
    }

    private ResponseEntity<?> respond(final String analysis,
            final Supplier<Object> call) {
        try {
            return ResponseEntity.ok(call.get());
        } catch (final DomainException e) {
            LOG.warn("{} analysis failed: {}", analysis, e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    /**
     * Request body for analyses that only need a root.
     *
     * @param root the directory to analyze
     */
    public record RootRequest(String root) {}

    /**
     * Request body for the module graph.
     *
     * @param root the directory to analyze
     * @param focus the path fragment to filter dependencies by, optional
     */
    public record GraphRequest(String root, String focus) {}

    /**
     * Request body for the blast radius.
     *
     * @param root the directory to analyze
     * @param target the module, absolute or relative to the root
     * @param maxDepth the deepest level to report, may be null
     */
    public record BlastRadiusRequest(String root, String target,
            Integer maxDepth) {}

    /**
     * Request body for dead export detection.
     *
     * @param root the directory to analyze
     * @param ignorePattern a file name glob to leave out, may be null
     */
    public record DeadExportsRequest(String root, String ignorePattern) {}
}
