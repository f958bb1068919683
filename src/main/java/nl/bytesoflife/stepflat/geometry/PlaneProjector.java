package nl.bytesoflife.stepflat.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a 2D coordinate frame on the plane perpendicular to a face normal and maps 3D points into it.
 */
public class PlaneProjector {

    private static final Logger log = LoggerFactory.getLogger(PlaneProjector.class);

    private static final double MIN_NORMAL_LENGTH = 1e-12;
    private static final double MIN_AXIS_LENGTH = 1e-9;
    private static final Vector3D[] AXES = {Vectors.X_AXIS, Vectors.Y_AXIS, Vectors.Z_AXIS};

    /**
     * Gram-Schmidt basis from the two global axes least aligned with the normal.
     * For a +Z normal this yields u = X and v = Y, so XY-plane geometry keeps its coordinates.
     *
     * @throws DegenerateNormalException if the normal has (near) zero length
     */
    public ProjectionBasis computeBasis(Vector3D normal) {
        if (normal == null || !(normal.length() > MIN_NORMAL_LENGTH)) {
            throw new DegenerateNormalException("Face normal has zero length: " + normal);
        }
        Vector3D n = normal.normalize();

        int first = leastAlignedAxis(n, -1);
        int second = leastAlignedAxis(n, first);

        Vector3D ref = AXES[first];
        Vector3D u = Vectors.minus(ref, Vectors.scale(n, n.dot(ref))).normalize();

        Vector3D ref2 = AXES[second];
        Vector3D v = Vectors.minus(ref2, Vectors.scale(n, n.dot(ref2)));
        v = Vectors.minus(v, Vectors.scale(u, u.dot(ref2)));
        if (v.length() < MIN_AXIS_LENGTH) {
            v = Vectors.cross(n, u);
        }
        v = v.normalize();

        return new ProjectionBasis(n, u, v);
    }

    /**
     * Basis for the normal, or for +Z when the normal is degenerate.
     */
    public ProjectionBasis basisOrDefault(Vector3D normal) {
        try {
            return computeBasis(normal);
        } catch (DegenerateNormalException e) {
            log.warn("{}; projecting onto the XY plane instead", e.getMessage());
            return computeBasis(Vectors.Z_AXIS);
        }
    }

    public Coordinate project(Vector3D point, ProjectionBasis basis) {
        return basis.project(point);
    }

    public List<Coordinate> project(List<Vector3D> points, ProjectionBasis basis) {
        List<Coordinate> projected = new ArrayList<>(points.size());
        for (Vector3D p : points) {
            projected.add(basis.project(p));
        }
        return projected;
    }

    private static int leastAlignedAxis(Vector3D n, int excluded) {
        int best = -1;
        double bestDot = Double.MAX_VALUE;
        for (int i = 0; i < AXES.length; i++) {
            if (i == excluded) continue;
            double dot = Math.abs(n.dot(AXES[i]));
            if (dot < bestDot) {
                bestDot = dot;
                best = i;
            }
        }
        return best;
    }
}
