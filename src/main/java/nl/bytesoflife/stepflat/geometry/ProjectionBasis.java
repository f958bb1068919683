package nl.bytesoflife.stepflat.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector3D;

/**
 * Orthonormal in-plane axes of a face. All points of one face must be projected with the same basis.
 */
public record ProjectionBasis(Vector3D normal, Vector3D u, Vector3D v) {

    public Coordinate project(Vector3D point) {
        return new Coordinate(point.dot(u), point.dot(v));
    }
}
