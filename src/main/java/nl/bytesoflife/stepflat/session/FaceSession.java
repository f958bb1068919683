package nl.bytesoflife.stepflat.session;

import nl.bytesoflife.stepflat.kernel.Face;

import java.time.Instant;
import java.util.List;

/**
 * Faces loaded from one uploaded file. Immutable, so it can be shared between request threads.
 */
public record FaceSession(String id, String filename, List<Face> faces, String note, Instant createdAt) {

    public FaceSession {
        faces = List.copyOf(faces);
    }

    public int faceCount() {
        return faces.size();
    }

    /**
     * @throws InvalidFaceIdException when the id is outside the face list
     */
    public Face face(int faceId) {
        if (faceId < 0 || faceId >= faces.size()) {
            throw new InvalidFaceIdException(faceId, faces.size());
        }
        return faces.get(faceId);
    }
}
