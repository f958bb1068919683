package nl.bytesoflife.stepflat.kernel;

public enum CurveKind {
    LINE,
    CIRCLE,
    ELLIPSE,
    OTHER
}
