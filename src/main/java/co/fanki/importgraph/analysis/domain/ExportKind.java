package co.fanki.importgraph.analysis.domain;

/**
 * Whether an exported symbol is a named export or the module default.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ExportKind {

    NAMED,

    DEFAULT

}
