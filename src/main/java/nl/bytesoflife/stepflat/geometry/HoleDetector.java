package nl.bytesoflife.stepflat.geometry;

import nl.bytesoflife.stepflat.model.BoundaryPath;
import nl.bytesoflife.stepflat.model.CirclePrimitive;
import nl.bytesoflife.stepflat.model.GeometryClass;
import nl.bytesoflife.stepflat.model.HoleCluster;
import nl.bytesoflife.stepflat.model.PolylinePrimitive;
import nl.bytesoflife.stepflat.model.Primitive;
import org.locationtech.jts.algorithm.RayCrossingCounter;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Guesses holes from the mesh vertices that fall inside a face outline.
 * <p>
 * Interior points are clustered greedily around seed points: a cluster is the set of unused points
 * whose distance from the seed lies within {@code radiusTolerance} of the smallest qualifying seed
 * distance. Points are visited in (x, y) order, so the result does not depend on mesh vertex order.
 */
public class HoleDetector {

    private static final Logger log = LoggerFactory.getLogger(HoleDetector.class);

    private final HoleDetectionOptions options;

    public HoleDetector() {
        this(HoleDetectionOptions.defaults());
    }

    public HoleDetector(HoleDetectionOptions options) {
        this.options = options;
    }

    /**
     * Hole primitives: a circle for round clusters, a closed polyline otherwise.
     */
    public List<Primitive> detect(List<Coordinate> points, BoundaryPath boundary) {
        List<Primitive> holes = new ArrayList<>();
        for (HoleCluster cluster : findClusters(points, boundary)) {
            if (cluster.size() < 3) continue;
            if (isCircle(cluster)) {
                holes.add(new CirclePrimitive(cluster.centroid(), cluster.meanRadius(), GeometryClass.HOLE));
            } else {
                holes.add(new PolylinePrimitive(cluster.points(), true, GeometryClass.HOLE));
            }
        }
        return holes;
    }

    public List<HoleCluster> findClusters(List<Coordinate> points, BoundaryPath boundary) {
        if (points.size() < options.minSamplePoints() || !boundary.isUsable()) return List.of();

        List<Coordinate> inside = interiorPoints(points, boundary);
        if (inside.size() < options.minClusterSize()) return List.of();

        return cluster(inside);
    }

    /**
     * Points strictly inside the boundary, by ray crossing (even-odd rule).
     */
    public List<Coordinate> interiorPoints(List<Coordinate> points, BoundaryPath boundary) {
        Coordinate[] ring = boundary.toRing();
        List<Coordinate> inside = new ArrayList<>();
        for (Coordinate p : points) {
            if (RayCrossingCounter.locatePointInRing(p, ring) == Location.INTERIOR) {
                inside.add(p);
            }
        }
        return inside;
    }

    List<HoleCluster> cluster(List<Coordinate> candidates) {
        List<Coordinate> points = candidates.stream().sorted().toList();
        boolean[] used = new boolean[points.size()];
        List<HoleCluster> clusters = new ArrayList<>();

        for (int i = 0; i < points.size(); i++) {
            if (used[i]) continue;
            Coordinate seed = points.get(i);

            List<Integer> indices = new ArrayList<>();
            List<Double> distances = new ArrayList<>();
            for (int j = 0; j < points.size(); j++) {
                if (used[j]) continue;
                double d = seed.distance(points.get(j));
                if (d >= options.minRadius() && d <= options.maxRadius()) {
                    indices.add(j);
                    distances.add(d);
                }
            }
            if (indices.size() < options.minClusterSize()) continue;

            List<Double> sortedDistances = distances.stream().sorted().toList();
            for (double d : sortedDistances) {
                double tolerance = d * options.radiusTolerance();
                List<Integer> members = new ArrayList<>();
                for (int k = 0; k < indices.size(); k++) {
                    if (Math.abs(distances.get(k) - d) <= tolerance) {
                        members.add(indices.get(k));
                    }
                }
                if (members.size() >= options.minClusterSize()) {
                    List<Coordinate> clusterPoints = new ArrayList<>(members.size());
                    for (int index : members) {
                        used[index] = true;
                        clusterPoints.add(points.get(index));
                    }
                    clusters.add(new HoleCluster(clusterPoints, d));
                    log.debug("Found potential hole with {} points at distance {}", clusterPoints.size(), d);
                    break;
                }
            }
        }
        return clusters;
    }

    /**
     * True when enough points lie close to the mean distance from the cluster centroid.
     */
    public boolean isCircle(HoleCluster cluster) {
        if (cluster.size() < options.minClusterSize()) return false;

        Coordinate center = cluster.centroid();
        double mean = cluster.meanRadius();
        double tolerance = mean * options.circularityTolerance();

        int onCircle = 0;
        for (Coordinate p : cluster.points()) {
            if (Math.abs(p.distance(center) - mean) <= tolerance) {
                onCircle++;
            }
        }
        return onCircle >= cluster.size() * options.circularityFraction();
    }
}
