package nl.bytesoflife.stepflat.kernel.memory;

import nl.bytesoflife.stepflat.geometry.Vectors;
import nl.bytesoflife.stepflat.kernel.CircleGeometry;
import nl.bytesoflife.stepflat.kernel.CurveEvaluationException;
import nl.bytesoflife.stepflat.kernel.Edge;
import nl.bytesoflife.stepflat.kernel.EllipseGeometry;
import org.locationtech.jts.math.Vector3D;

/**
 * Base class for in-memory edges over a parameter domain.
 */
public abstract class AbstractEdge implements Edge {

    private static final int LENGTH_SEGMENTS = 64;

    private final double first;
    private final double last;

    protected AbstractEdge(double first, double last) {
        this.first = first;
        this.last = last;
    }

    @Override
    public double first() {
        return first;
    }

    @Override
    public double last() {
        return last;
    }

    @Override
    public CircleGeometry circle() {
        throw new CurveEvaluationException(curveKind() + " edge has no circle geometry");
    }

    @Override
    public EllipseGeometry ellipse() {
        throw new CurveEvaluationException(curveKind() + " edge has no ellipse geometry");
    }

    /**
     * Arc length, approximated by a sampled polyline unless a subclass knows better.
     */
    public double arcLength() {
        double length = 0;
        Vector3D previous = valueAt(first);
        for (int i = 1; i <= LENGTH_SEGMENTS; i++) {
            Vector3D current = valueAt(first + (last - first) * i / LENGTH_SEGMENTS);
            length += Vectors.distance(previous, current);
            previous = current;
        }
        return length;
    }
}
