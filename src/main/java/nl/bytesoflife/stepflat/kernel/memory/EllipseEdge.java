package nl.bytesoflife.stepflat.kernel.memory;

import nl.bytesoflife.stepflat.geometry.Vectors;
import nl.bytesoflife.stepflat.kernel.CurveEvaluationException;
import nl.bytesoflife.stepflat.kernel.CurveKind;
import nl.bytesoflife.stepflat.kernel.EllipseGeometry;
import org.locationtech.jts.math.Vector3D;

/**
 * Ellipse or elliptical arc, parameterised by the eccentric angle.
 */
public class EllipseEdge extends AbstractEdge {

    private final Vector3D center;
    private final Vector3D majorDirection;
    private final Vector3D minorDirection;
    private final double majorRadius;
    private final double minorRadius;

    public EllipseEdge(Vector3D center, Vector3D axis, Vector3D majorDirection,
                       double majorRadius, double minorRadius, double first, double last) {
        super(first, last);
        this.center = center;
        this.majorDirection = majorDirection.normalize();
        this.minorDirection = Vectors.cross(axis.normalize(), this.majorDirection);
        this.majorRadius = majorRadius;
        this.minorRadius = minorRadius;
    }

    public static EllipseEdge inXyPlane(double cx, double cy, double z, double majorRadius, double minorRadius,
                                        double first, double last) {
        return new EllipseEdge(new Vector3D(cx, cy, z), Vectors.Z_AXIS, Vectors.X_AXIS,
                majorRadius, minorRadius, first, last);
    }

    @Override
    public CurveKind curveKind() {
        return CurveKind.ELLIPSE;
    }

    @Override
    public Vector3D valueAt(double parameter) {
        Vector3D offset = Vectors.plus(
                Vectors.scale(majorDirection, majorRadius * Math.cos(parameter)),
                Vectors.scale(minorDirection, minorRadius * Math.sin(parameter)));
        return Vectors.plus(center, offset);
    }

    @Override
    public EllipseGeometry ellipse() {
        try {
            return new EllipseGeometry(center, majorDirection, majorRadius, minorRadius);
        } catch (IllegalArgumentException e) {
            throw new CurveEvaluationException("Invalid ellipse: " + e.getMessage(), e);
        }
    }
}
