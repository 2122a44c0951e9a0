package co.fanki.importgraph.analysis.domain;

/**
 * How sure the detector is that a dead export is really unused.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DeadExportConfidence {

    /** No importer in the tree and nothing suggests outside use. */
    HIGH,

    /** The owning file may be consumed from outside the analyzed tree. */
    MEDIUM

}
