package nl.bytesoflife.stepflat.writer;

import nl.bytesoflife.stepflat.export.FaceExport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders an exported face and stores it in a temporary file. Nothing is left on disk when
 * writing fails.
 */
public class ArtifactExporter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactExporter.class);

    private final Path directory;

    public ArtifactExporter() {
        this(null);
    }

    /**
     * @param directory where artifacts are created, or null for the system temp directory
     */
    public ArtifactExporter(Path directory) {
        this.directory = directory;
    }

    public ExportArtifact write(FaceExport export, DrawingWriter writer, String sourceFilename) {
        String extension = writer.fileExtension();
        byte[] content = writer.render(export);

        Path file = null;
        try {
            file = directory != null
                    ? Files.createTempFile(directory, "stepflat-", "." + extension)
                    : Files.createTempFile("stepflat-", "." + extension);
            Files.write(file, content);
        } catch (IOException e) {
            deleteQuietly(file);
            throw new ExportWriteException("Failed to write " + extension.toUpperCase() + " for face "
                    + (export.faceId() + 1), e);
        }

        log.info("Wrote {} ({} bytes, {} entities)", file, content.length, export.entityCount());
        return new ExportArtifact(file, downloadName(sourceFilename, export.faceId(), extension),
                writer.contentType(), export.entityCount());
    }

    /**
     * {@code <base>_face_<n>.<ext>} with the face number counted from one.
     */
    public static String downloadName(String sourceFilename, int faceId, String extension) {
        String base = sourceFilename == null || sourceFilename.isEmpty() ? "face" : sourceFilename;
        int dot = base.lastIndexOf('.');
        if (dot > 0) base = base.substring(0, dot);
        return base + "_face_" + (faceId + 1) + "." + extension;
    }

    /**
     * Deletes an artifact, logging instead of failing when the file cannot be removed.
     */
    public static void delete(ExportArtifact artifact) {
        deleteQuietly(artifact.path());
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
