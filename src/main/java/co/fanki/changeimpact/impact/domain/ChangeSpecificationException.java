package co.fanki.changeimpact.impact.domain;

import co.fanki.changeimpact.shared.DomainException;

/**
 * The change specification is missing, unreadable or malformed.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ChangeSpecificationException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code reported for this failure. */
    public static final String ERROR_CODE = "INVALID_CHANGE_SPECIFICATION";

    /**
     * Creates the exception.
     *
     * @param message the error message
     */
    public ChangeSpecificationException(final String message) {
        super(message, ERROR_CODE);
    }

    /**
     * Creates the exception with its cause.
     *
     * @param message the error message
     * @param cause the underlying parse or I/O failure
     */
    public ChangeSpecificationException(final String message,
            final Throwable cause) {
        super(message, ERROR_CODE, cause);
    }

}
