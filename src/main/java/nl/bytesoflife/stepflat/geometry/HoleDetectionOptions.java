package nl.bytesoflife.stepflat.geometry;

/**
 * Tunables of the mesh hole heuristic. Distances are in model units.
 *
 * @param minSamplePoints      fewer projected points than this and no holes are searched
 * @param minRadius            smallest center-to-point distance considered part of a hole
 * @param maxRadius            largest center-to-point distance considered part of a hole
 * @param radiusTolerance      relative band around a seed distance, e.g. 0.2 for ±20 %
 * @param minClusterSize       points needed to accept a cluster
 * @param circularityTolerance relative deviation from the mean radius still counted as on-circle
 * @param circularityFraction  share of on-circle points needed to call a cluster a circle
 */
public record HoleDetectionOptions(int minSamplePoints,
                                   double minRadius,
                                   double maxRadius,
                                   double radiusTolerance,
                                   int minClusterSize,
                                   double circularityTolerance,
                                   double circularityFraction) {

    public HoleDetectionOptions {
        if (minRadius < 0 || maxRadius < minRadius) {
            throw new IllegalArgumentException("Invalid radius bounds [" + minRadius + ", " + maxRadius + "]");
        }
        if (minClusterSize < 3) {
            throw new IllegalArgumentException("Cluster size must be at least 3");
        }
    }

    public static HoleDetectionOptions defaults() {
        return new HoleDetectionOptions(10, 1.0, 10.0, 0.2, 6, 0.25, 0.75);
    }

    public HoleDetectionOptions withRadiusBounds(double min, double max) {
        return new HoleDetectionOptions(minSamplePoints, min, max, radiusTolerance, minClusterSize,
                circularityTolerance, circularityFraction);
    }

    public HoleDetectionOptions withMinClusterSize(int size) {
        return new HoleDetectionOptions(minSamplePoints, minRadius, maxRadius, radiusTolerance, size,
                circularityTolerance, circularityFraction);
    }

    public HoleDetectionOptions withCircularity(double tolerance, double fraction) {
        return new HoleDetectionOptions(minSamplePoints, minRadius, maxRadius, radiusTolerance, minClusterSize,
                tolerance, fraction);
    }
}
