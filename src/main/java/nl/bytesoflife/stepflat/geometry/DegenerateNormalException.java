package nl.bytesoflife.stepflat.geometry;

public class DegenerateNormalException extends RuntimeException {

    public DegenerateNormalException(String message) {
        super(message);
    }
}
