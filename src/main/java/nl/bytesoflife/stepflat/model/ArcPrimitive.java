package nl.bytesoflife.stepflat.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * Circular arc in the projection plane.
 * <p>
 * {@code start} and {@code end} are the projected end points in edge traversal order, with
 * {@code sweepFlag} 1 for counter-clockwise travel. {@code startAngle} and {@code endAngle}
 * (degrees, [0, 360)) always describe the arc counter-clockwise from start angle to end angle,
 * so they are swapped relative to the end points for clockwise arcs.
 */
public record ArcPrimitive(Coordinate center, double radius,
                           Coordinate start, Coordinate end,
                           double startAngle, double endAngle,
                           int sweepFlag, int largeArcFlag,
                           GeometryClass geometryClass) implements Primitive {

    /**
     * Envelope of the end points plus every axis extreme (0°, 90°, 180°, 270°) the arc passes.
     */
    @Override
    public Envelope envelope() {
        Envelope env = new Envelope(start, end);
        double sweep = normalize(endAngle - startAngle);
        for (int quadrant = 0; quadrant < 4; quadrant++) {
            double angle = quadrant * 90.0;
            if (normalize(angle - startAngle) <= sweep) {
                double rad = Math.toRadians(angle);
                env.expandToInclude(center.x + radius * Math.cos(rad), center.y + radius * Math.sin(rad));
            }
        }
        return env;
    }

    private static double normalize(double degrees) {
        double d = degrees % 360;
        return d < 0 ? d + 360 : d;
    }

    public boolean isCounterClockwise() {
        return sweepFlag == 1;
    }
}
