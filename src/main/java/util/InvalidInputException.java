package util;

/**
 * Raised when caller-supplied input is rejected before any pixel is touched:
 * malformed buffers, non-positive dimensions, out-of-range strength, unknown
 * modes, bad watermark opacity or placement.
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}
