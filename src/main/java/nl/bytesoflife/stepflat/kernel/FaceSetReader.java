package nl.bytesoflife.stepflat.kernel;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads the faces of an exchange file.
 */
public interface FaceSetReader {

    FaceSet read(Path file) throws IOException;

    /**
     * Faces in file order, plus an optional note about how they were obtained.
     */
    record FaceSet(List<Face> faces, String note) {

        public FaceSet {
            faces = List.copyOf(faces);
        }
    }
}
