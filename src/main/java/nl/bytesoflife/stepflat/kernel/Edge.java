package nl.bytesoflife.stepflat.kernel;

import org.locationtech.jts.math.Vector3D;

/**
 * A curve segment of a wire, evaluated over the parameter domain [first, last].
 * Implementations signal unreadable curve data with {@link CurveEvaluationException}.
 */
public interface Edge {

    CurveKind curveKind();

    double first();

    double last();

    Vector3D valueAt(double parameter);

    /**
     * Only meaningful when {@link #curveKind()} is {@link CurveKind#CIRCLE}.
     *
     * @throws CurveEvaluationException when the edge has no valid circle description
     */
    CircleGeometry circle();

    /**
     * Only meaningful when {@link #curveKind()} is {@link CurveKind#ELLIPSE}.
     *
     * @throws CurveEvaluationException when the edge has no valid ellipse description
     */
    EllipseGeometry ellipse();
}
