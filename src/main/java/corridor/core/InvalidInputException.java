package corridor.core;

/**
 * Raised when a caller supplies a malformed corridor network: a non-square or too small capacity matrix,
 * a negative capacity, or source/sink index sets that are empty, duplicated, out of range or overlapping.
 *
 * <p>Thrown before any computation begins, so no partial state is ever produced. The message names the
 * offending row, column, index or dimension.</p>
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
