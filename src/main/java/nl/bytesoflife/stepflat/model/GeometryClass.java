package nl.bytesoflife.stepflat.model;

/**
 * Role of a primitive on its face: part of the outer loop or of a cut-out.
 */
public enum GeometryClass {
    BOUNDARY("boundary"),
    HOLE("hole");

    private final String tag;

    GeometryClass(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
