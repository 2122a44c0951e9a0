package co.fanki.importgraph.analysis.domain;

/**
 * How far a change to a module spreads.
 *
 * <p>Thresholds: up to {@value #NARROW_LIMIT} affected files with no entry
 * point reached is narrow; up to {@value #MEDIUM_LIMIT} files is medium;
 * anything above is wide. Reaching an entry point lifts a change that
 * would be narrow to medium but does not on its own make it wide.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ImpactClassification {

    /** Few files affected, no entry point. */
    NARROW("Low risk: few files affected, no entry points. Proceed with"
            + " care."),

    /** Moderate spread, or any spread reaching an entry point. */
    MEDIUM("Medium risk: test all affected paths before merging."),

    /** Many files depend on the module. */
    WIDE("High risk: consider an incremental rollout, many files depend on"
            + " this module.");

    /** Maximum affected files for a narrow impact. */
    public static final int NARROW_LIMIT = 5;

    /** Maximum affected files for a medium impact. */
    public static final int MEDIUM_LIMIT = 20;

    private final String guidance;

    ImpactClassification(final String theGuidance) {
        this.guidance = theGuidance;
    }

    /**
     * Returns the risk guidance for this classification.
     *
     * @return the guidance text
     */
    public String guidance() {
        return guidance;
    }

    /**
     * Classifies an impact.
     *
     * @param affected the number of transitively affected files
     * @param entryPointReached whether any affected file is an entry point
     * @return the classification
     */
    public static ImpactClassification of(final int affected,
            final boolean entryPointReached) {
        if (affected <= NARROW_LIMIT && !entryPointReached) {
            return NARROW;
        }
        if (affected <= MEDIUM_LIMIT) {
            return MEDIUM;
        }
        return WIDE;
    }

}
