package nl.bytesoflife.stepflat.kernel.memory;

import nl.bytesoflife.stepflat.geometry.Vectors;
import nl.bytesoflife.stepflat.kernel.CurveKind;
import org.locationtech.jts.math.Vector3D;

/**
 * Straight segment, parameterised over [0, 1].
 */
public class LineEdge extends AbstractEdge {

    private final Vector3D start;
    private final Vector3D end;

    public LineEdge(Vector3D start, Vector3D end) {
        super(0, 1);
        this.start = start;
        this.end = end;
    }

    public LineEdge(double x1, double y1, double z1, double x2, double y2, double z2) {
        this(new Vector3D(x1, y1, z1), new Vector3D(x2, y2, z2));
    }

    @Override
    public CurveKind curveKind() {
        return CurveKind.LINE;
    }

    @Override
    public Vector3D valueAt(double parameter) {
        return Vectors.plus(start, Vectors.scale(Vectors.minus(end, start), parameter));
    }

    @Override
    public double arcLength() {
        return Vectors.distance(start, end);
    }
}
