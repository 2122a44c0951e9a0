package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.Preconditions;

import java.util.List;
import java.util.Set;

/**
 * What a {@link ModuleExtractor} found in one file.
 *
 * @param file the relative path of the analyzed module
 * @param imports the import edges, unresolved, in source order
 * @param exports the exported symbols, in source order
 * @param identifiers every identifier-like word written in the file
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileAnalysis(
        String file,
        List<ImportEdge> imports,
        List<ExportedSymbol> exports,
        Set<String> identifiers
) {

    public FileAnalysis {
        Preconditions.requireNonBlank(file, "File is required");
        imports = imports == null ? List.of() : List.copyOf(imports);
        exports = exports == null ? List.of() : List.copyOf(exports);
        identifiers = identifiers == null ? Set.of() : Set.copyOf(identifiers);
    }

    /**
     * Creates an analysis that records no identifiers.
     *
     * @param file the relative path of the analyzed module
     * @param imports the import edges
     * @param exports the exported symbols
     */
    public FileAnalysis(final String file, final List<ImportEdge> imports,
            final List<ExportedSymbol> exports) {
        this(file, imports, exports, Set.of());
    }

}
