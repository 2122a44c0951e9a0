package co.fanki.importgraph.analysis.domain;

/**
 * An exported symbol that nothing in the analyzed tree imports.
 *
 * @param file the owning module
 * @param symbol the exported name
 * @param kind named or default export
 * @param confidence how likely the export is really unused
 * @param reason a short explanation of the confidence
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DeadExport(
        String file,
        String symbol,
        ExportKind kind,
        DeadExportConfidence confidence,
        String reason
) {
}
