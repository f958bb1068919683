package nl.bytesoflife.stepflat.export;

/**
 * Numeric settings of the face export pipeline. Lengths are in model units, angles as noted.
 *
 * @param curveSamples            segments used to flatten free-form edges
 * @param secondaryCurveSamples   segments used for elliptical arcs and edges whose analytic data failed
 * @param fullTurnTolerance       radians; a circle or ellipse edge spanning 2π within this is closed
 * @param duplicatePointTolerance consecutive polyline points closer than this are merged
 * @param arcCenterTolerance      clustering distance for candidate centers when merging arcs
 * @param fullCircleCoverage      estimated degrees a group of arcs must cover to become one circle
 * @param placeholderSize         side of the square emitted when no outline can be recovered
 */
public record ExportOptions(int curveSamples,
                            int secondaryCurveSamples,
                            double fullTurnTolerance,
                            double duplicatePointTolerance,
                            double arcCenterTolerance,
                            double fullCircleCoverage,
                            double placeholderSize) {

    public ExportOptions {
        if (curveSamples < 1 || secondaryCurveSamples < 1) {
            throw new IllegalArgumentException("Curve sample counts must be positive");
        }
        if (placeholderSize <= 0) {
            throw new IllegalArgumentException("Placeholder size must be positive");
        }
    }

    public static ExportOptions defaults() {
        return new ExportOptions(20, 12, 0.01, 0.001, 0.1, 300, 10);
    }

    public ExportOptions withCurveSamples(int samples, int secondarySamples) {
        return new ExportOptions(samples, secondarySamples, fullTurnTolerance, duplicatePointTolerance,
                arcCenterTolerance, fullCircleCoverage, placeholderSize);
    }

    public ExportOptions withArcCenterTolerance(double tolerance) {
        return new ExportOptions(curveSamples, secondaryCurveSamples, fullTurnTolerance, duplicatePointTolerance,
                tolerance, fullCircleCoverage, placeholderSize);
    }

    public ExportOptions withFullCircleCoverage(double degrees) {
        return new ExportOptions(curveSamples, secondaryCurveSamples, fullTurnTolerance, duplicatePointTolerance,
                arcCenterTolerance, degrees, placeholderSize);
    }
}
