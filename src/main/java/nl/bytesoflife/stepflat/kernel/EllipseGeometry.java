package nl.bytesoflife.stepflat.kernel;

import org.locationtech.jts.math.Vector3D;

/**
 * Analytic description of an elliptical edge curve in model space.
 * {@code majorAxisDirection} is a unit vector along the major axis.
 */
public record EllipseGeometry(Vector3D center, Vector3D majorAxisDirection,
                              double majorRadius, double minorRadius) {

    public EllipseGeometry {
        if (majorRadius <= 0 || minorRadius <= 0) {
            throw new IllegalArgumentException("Ellipse radii must be positive");
        }
        if (minorRadius > majorRadius) {
            throw new IllegalArgumentException("Minor radius exceeds major radius");
        }
    }

    public double ratio() {
        return minorRadius / majorRadius;
    }
}
