package nl.bytesoflife.stepflat.session;

public class InvalidFaceIdException extends RuntimeException {

    public InvalidFaceIdException(int faceId, int faceCount) {
        super("Invalid face ID " + faceId + " (file has " + faceCount + " faces)");
    }
}
