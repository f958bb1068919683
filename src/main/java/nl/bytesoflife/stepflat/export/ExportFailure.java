package nl.bytesoflife.stepflat.export;

/**
 * Why a stage of the face export could not produce geometry.
 */
public enum ExportFailure {
    NO_GEOMETRY_FOUND("no wires or mesh points"),
    CURVE_EVALUATION("no edge could be evaluated"),
    BOUNDARY_RECONSTRUCTION("fewer than 3 boundary points"),
    KERNEL_ERROR("kernel error"),
    DEGENERATE_NORMAL("degenerate face normal");

    private final String description;

    ExportFailure(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
