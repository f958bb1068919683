package nl.bytesoflife.stepflat.kernel;

import org.locationtech.jts.math.Vector3D;

/**
 * Analytic description of a circular edge curve in model space.
 */
public record CircleGeometry(Vector3D center, double radius) {

    public CircleGeometry {
        if (radius <= 0) {
            throw new IllegalArgumentException("Circle radius must be positive: " + radius);
        }
    }
}
