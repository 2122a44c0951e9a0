package co.fanki.importgraph.analysis.domain;

/**
 * The syntactic form an import takes in the importing file.
 *
 * <p>The kind decides how the dead export detector reads the edge: only
 * {@link #NAMED}, {@link #DEFAULT} and named {@link #RE_EXPORT} edges carry
 * an enumerable symbol list. Every other form may reach any export of its
 * target.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ImportKind {

    /** {@code import { a, b as c } from './x'}. */
    NAMED(true),

    /** {@code import x from './x'}. */
    DEFAULT(true),

    /** {@code import * as ns from './x'} or a bare side-effect import. */
    NAMESPACE(false),

    /** {@code export { a } from './x'} or {@code export * from './x'}. */
    RE_EXPORT(true),

    /** {@code import('./x')}. */
    DYNAMIC(false),

    /** {@code require('./x')}. */
    REQUIRE(false);

    private final boolean symbolic;

    ImportKind(final boolean isSymbolic) {
        this.symbolic = isSymbolic;
    }

    /**
     * Whether edges of this kind can name the symbols they bind.
     *
     * @return true for named, default and re-export forms
     */
    public boolean isSymbolic() {
        return symbolic;
    }

}
