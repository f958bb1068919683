package nl.bytesoflife.stepflat.export;

/**
 * Stage of the export that produced a face's primitives.
 */
public enum ExportStage {
    /** Exact curves from the face's wires. */
    EXACT,
    /** Outline recovered from the face's triangulation. */
    MESH,
    /** Placeholder square. */
    DEFAULT
}
