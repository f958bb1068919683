package nl.bytesoflife.stepflat.export;

import org.locationtech.jts.geom.Coordinate;

/**
 * Decides which way a projected circular arc runs by checking where its mid-parameter point lies.
 * Projection can mirror a curve, so the kernel's parameter direction alone is not enough.
 */
public class ArcDirectionResolver {

    public ArcDirection resolve(Coordinate center, Coordinate start, Coordinate end, Coordinate mid) {
        return resolveAngles(polarAngle(center, start), polarAngle(center, end), polarAngle(center, mid));
    }

    public ArcDirection resolveAngles(double startAngle, double endAngle, double midAngle) {
        double start = normalizeDegrees(startAngle);
        double end = normalizeDegrees(endAngle);
        double mid = normalizeDegrees(midAngle);

        if (isBetweenCounterClockwise(start, end, mid)) {
            double diff = normalizeDegrees(end - start);
            return new ArcDirection(start, end, 1, diff > 180 ? 1 : 0, diff);
        }
        double diff = normalizeDegrees(start - end);
        return new ArcDirection(end, start, 0, diff > 180 ? 1 : 0, diff);
    }

    /**
     * True when {@code mid} lies on the counter-clockwise sweep from {@code start} to {@code end}.
     */
    static boolean isBetweenCounterClockwise(double start, double end, double mid) {
        start = normalizeDegrees(start);
        end = normalizeDegrees(end);
        mid = normalizeDegrees(mid);
        if (start <= end) {
            return start <= mid && mid <= end;
        }
        return mid >= start || mid <= end;
    }

    /**
     * Angle of {@code p} around {@code center} in degrees, [0, 360).
     */
    static double polarAngle(Coordinate center, Coordinate p) {
        return normalizeDegrees(Math.toDegrees(Math.atan2(p.y - center.y, p.x - center.x)));
    }

    static double normalizeDegrees(double degrees) {
        double r = degrees % 360.0;
        if (r < 0) r += 360.0;
        if (r >= 360.0) r -= 360.0;
        return r;
    }
}
