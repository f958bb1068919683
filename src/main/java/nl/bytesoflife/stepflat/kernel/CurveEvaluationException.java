package nl.bytesoflife.stepflat.kernel;

/**
 * Raised by a kernel implementation when curve data of an edge cannot be read or evaluated.
 */
public class CurveEvaluationException extends RuntimeException {

    public CurveEvaluationException(String message) {
        super(message);
    }

    public CurveEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
