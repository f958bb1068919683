package nl.bytesoflife.stepflat.writer;

import nl.bytesoflife.stepflat.export.FaceExport;

/**
 * Renders the primitives of an exported face into one drawing format.
 */
public interface DrawingWriter {

    byte[] render(FaceExport export);

    /**
     * File extension without the leading dot.
     */
    String fileExtension();

    String contentType();
}
