package nl.bytesoflife.stepflat.export;

/**
 * Travel direction and span of a circular arc.
 *
 * @param startAngle   degrees; for clockwise arcs this is the angle of the arc's end point
 * @param endAngle     degrees; for clockwise arcs this is the angle of the arc's start point
 * @param sweepFlag    1 for counter-clockwise travel, 0 for clockwise
 * @param largeArcFlag 1 when the arc spans more than 180 degrees
 * @param angleDiff    span in degrees along the travel direction
 */
public record ArcDirection(double startAngle, double endAngle, int sweepFlag, int largeArcFlag,
                           double angleDiff) {

    public boolean isCounterClockwise() {
        return sweepFlag == 1;
    }
}
