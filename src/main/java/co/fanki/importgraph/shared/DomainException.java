package co.fanki.importgraph.shared;

/**
 * Raised when an analysis request cannot run against the given input.
 *
 * <p>Carries a machine-readable error code so the REST and MCP surfaces
 * can report the failure without parsing the message. The codes used by
 * the engine are listed as constants on this class.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** The analysis root does not exist or is not a readable directory. */
    public static final String ROOT_NOT_FOUND = "ROOT_NOT_FOUND";

    /** The impact target is not part of the discovered module set. */
    public static final String TARGET_NOT_FOUND = "TARGET_NOT_FOUND";

    /** Walking the analysis root failed half-way. */
    public static final String DISCOVERY_FAILED = "DISCOVERY_FAILED";

    /** Extraction workers did not complete. */
    public static final String EXTRACTION_FAILED = "EXTRACTION_FAILED";

    /** Error code for a request argument outside its allowed range. */
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    private final String errorCode;

    /**
     * Creates a new domain exception with a generic error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        super(message);
        this.errorCode = "DOMAIN_ERROR";
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param errorCode the specific error code
     */
    public DomainException(final String message, final String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param errorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String errorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
