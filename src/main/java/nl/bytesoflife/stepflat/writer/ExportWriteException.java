package nl.bytesoflife.stepflat.writer;

/**
 * Thrown when a rendered drawing cannot be persisted.
 */
public class ExportWriteException extends RuntimeException {

    public ExportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
