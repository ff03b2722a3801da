package ae.teletronics.attachments.application.exceptions;

/**
 * Thrown when an analyzer rejects an upload (disallowed type, too large, infected, ...).
 * Raised before any bytes are committed to storage, so callers can show {@link #reason()} as a
 * validation message instead of offering a retry.
 */
public class InvalidFileException extends RuntimeException {

    private final String reason;

    public InvalidFileException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public InvalidFileException(String reason, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
