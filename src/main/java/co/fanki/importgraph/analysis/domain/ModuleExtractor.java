package co.fanki.importgraph.analysis.domain;

/**
 * Extracts the import edges and exported symbols of a single module.
 *
 * <p>Implementations work on the file text alone and must not look at
 * other files: edges are returned unresolved and the
 * {@link ModuleResolver} completes them once every file is known. This
 * is the seam where a parse-tree based extractor can replace the pattern
 * based one without touching graph building or analysis.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ModuleExtractor {

    /**
     * Extracts imports and exports from a module.
     *
     * @param file the module to analyze
     * @return the unresolved edges and the exports, in source order
     */
    FileAnalysis extract(ModuleFile file);

}
