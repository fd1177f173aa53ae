package co.fanki.changeimpact.shared;

/**
 * An external collaborator (code structure source, contract validator)
 * failed or returned an unusable answer.
 *
 * <p>Never retried by the engine.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CollaboratorException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Default error code for collaborator failures. */
    public static final String ERROR_CODE = "COLLABORATOR_FAILURE";

    /**
     * Creates the exception.
     *
     * @param message the error message
     */
    public CollaboratorException(final String message) {
        super(message, ERROR_CODE);
    }

    /**
     * Creates the exception with its cause.
     *
     * @param message the error message
     * @param cause the collaborator failure
     */
    public CollaboratorException(final String message, final Throwable cause) {
        super(message, ERROR_CODE, cause);
    }

    /**
     * Creates the exception with a more specific error code.
     *
     * @param message the error message
     * @param errorCode the error code
     */
    protected CollaboratorException(final String message,
            final String errorCode) {
        super(message, errorCode);
    }

}
