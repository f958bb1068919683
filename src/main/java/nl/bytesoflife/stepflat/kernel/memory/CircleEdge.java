package nl.bytesoflife.stepflat.kernel.memory;

import nl.bytesoflife.stepflat.geometry.Vectors;
import nl.bytesoflife.stepflat.kernel.CircleGeometry;
import nl.bytesoflife.stepflat.kernel.CurveEvaluationException;
import nl.bytesoflife.stepflat.kernel.CurveKind;
import org.locationtech.jts.math.Vector3D;

/**
 * Circle or circular arc. The parameter is the angle in radians measured from
 * {@code xDirection} towards {@code axis × xDirection}.
 */
public class CircleEdge extends AbstractEdge {

    private final Vector3D center;
    private final double radius;
    private final Vector3D xDirection;
    private final Vector3D yDirection;

    public CircleEdge(Vector3D center, Vector3D axis, Vector3D xDirection, double radius,
                      double first, double last) {
        super(first, last);
        this.center = center;
        this.radius = radius;
        this.xDirection = xDirection.normalize();
        this.yDirection = Vectors.cross(axis.normalize(), this.xDirection);
    }

    /**
     * Arc in a plane parallel to XY, counter-clockwise when seen from +Z.
     */
    public static CircleEdge inXyPlane(double cx, double cy, double z, double radius,
                                       double first, double last) {
        return new CircleEdge(new Vector3D(cx, cy, z), Vectors.Z_AXIS, Vectors.X_AXIS, radius, first, last);
    }

    public static CircleEdge fullCircle(double cx, double cy, double z, double radius) {
        return inXyPlane(cx, cy, z, radius, 0, 2 * Math.PI);
    }

    @Override
    public CurveKind curveKind() {
        return CurveKind.CIRCLE;
    }

    @Override
    public Vector3D valueAt(double parameter) {
        Vector3D offset = Vectors.plus(
                Vectors.scale(xDirection, radius * Math.cos(parameter)),
                Vectors.scale(yDirection, radius * Math.sin(parameter)));
        return Vectors.plus(center, offset);
    }

    @Override
    public CircleGeometry circle() {
        try {
            return new CircleGeometry(center, radius);
        } catch (IllegalArgumentException e) {
            throw new CurveEvaluationException("Invalid circle: " + e.getMessage(), e);
        }
    }

    @Override
    public double arcLength() {
        return radius * Math.abs(last() - first());
    }
}
