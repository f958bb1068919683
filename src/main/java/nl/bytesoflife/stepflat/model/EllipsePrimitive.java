package nl.bytesoflife.stepflat.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * Full ellipse. {@code majorAxis} points from the center to the end of the major axis, so its
 * length is the major radius; {@code ratio} is minor radius over major radius.
 */
public record EllipsePrimitive(Coordinate center, Coordinate majorAxis, double ratio,
                               GeometryClass geometryClass) implements Primitive {

    public double majorRadius() {
        return Math.hypot(majorAxis.x, majorAxis.y);
    }

    public double minorRadius() {
        return majorRadius() * ratio;
    }

    /**
     * Rotation of the major axis from the U axis, in degrees.
     */
    public double rotationDegrees() {
        return Math.toDegrees(Math.atan2(majorAxis.y, majorAxis.x));
    }

    @Override
    public Envelope envelope() {
        double r = majorRadius();
        return new Envelope(center.x - r, center.x + r, center.y - r, center.y + r);
    }
}
