package nl.bytesoflife.stepflat.writer;

import java.nio.file.Path;

/**
 * A rendered drawing on disk, waiting to be sent and deleted.
 *
 * @param path         temporary file holding the drawing
 * @param downloadName file name offered to the client
 * @param contentType  MIME type of the drawing
 * @param entityCount  number of primitives drawn
 */
public record ExportArtifact(Path path, String downloadName, String contentType, int entityCount) {
}
