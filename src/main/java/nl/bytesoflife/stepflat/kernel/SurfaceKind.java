package nl.bytesoflife.stepflat.kernel;

public enum SurfaceKind {
    PLANE("Plane"),
    CURVED("Curved"),
    UNKNOWN("Unknown");

    private final String displayName;

    SurfaceKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
