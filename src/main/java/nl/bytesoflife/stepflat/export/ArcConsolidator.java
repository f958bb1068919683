package nl.bytesoflife.stepflat.export;

import nl.bytesoflife.stepflat.model.ArcPrimitive;
import nl.bytesoflife.stepflat.model.CirclePrimitive;
import nl.bytesoflife.stepflat.model.GeometryClass;
import nl.bytesoflife.stepflat.model.Primitive;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges arcs that together describe one full circle, as kernels often split round holes into
 * two or more arc edges.
 * <p>
 * Arcs are grouped by geometry class and radius rounded to three decimals. For every arc both
 * centers consistent with its end points are candidates; a group becomes a single circle when one
 * center cluster holds at least as many candidates as there are arcs in the group and the
 * estimated coverage reaches {@link ExportOptions#fullCircleCoverage()}.
 */
public class ArcConsolidator {

    private static final Logger log = LoggerFactory.getLogger(ArcConsolidator.class);

    private static final double CHORD_TOLERANCE = 1e-6;
    private static final double MIN_CHORD_COMPONENT = 0.001;

    private final ExportOptions options;

    public ArcConsolidator() {
        this(ExportOptions.defaults());
    }

    public ArcConsolidator(ExportOptions options) {
        this.options = options;
    }

    /**
     * Non-arc primitives come first in their original order, followed by each arc group in
     * first-seen order, either as one circle or as its unchanged arcs.
     */
    public List<Primitive> consolidate(List<Primitive> primitives) {
        List<Primitive> result = new ArrayList<>();
        Map<GroupKey, List<ArcPrimitive>> groups = new LinkedHashMap<>();

        for (Primitive p : primitives) {
            if (p instanceof ArcPrimitive arc) {
                groups.computeIfAbsent(GroupKey.of(arc), k -> new ArrayList<>()).add(arc);
            } else {
                result.add(p);
            }
        }

        for (Map.Entry<GroupKey, List<ArcPrimitive>> entry : groups.entrySet()) {
            GroupKey key = entry.getKey();
            List<ArcPrimitive> arcs = entry.getValue();
            CirclePrimitive circle = tryMerge(key, arcs);
            if (circle != null) {
                log.debug("Consolidated {} arcs into circle r={} [{}]", arcs.size(), circle.radius(),
                        key.geometryClass().getTag());
                result.add(circle);
            } else {
                result.addAll(arcs);
            }
        }
        return result;
    }

    private CirclePrimitive tryMerge(GroupKey key, List<ArcPrimitive> arcs) {
        if (arcs.size() < 2) return null;

        double radius = key.radius();
        List<Coordinate> candidates = new ArrayList<>();
        double coverage = 0;
        for (ArcPrimitive arc : arcs) {
            candidates.addAll(candidateCenters(arc.start(), arc.end(), radius));
            coverage += estimateCoverageDegrees(arc);
        }
        if (candidates.isEmpty()) return null;

        List<Coordinate> best = largestCluster(candidates);
        if (best.size() >= arcs.size() && coverage >= options.fullCircleCoverage()) {
            return new CirclePrimitive(mean(best), radius, key.geometryClass());
        }
        return null;
    }

    /**
     * Both centers of a circle of the given radius through {@code start} and {@code end}. A chord
     * equal to the diameter (within tolerance) yields its midpoint twice; a longer chord yields none.
     */
    List<Coordinate> candidateCenters(Coordinate start, Coordinate end, double radius) {
        double dx = end.x - start.x;
        double dy = end.y - start.y;
        double chord = Math.hypot(dx, dy);
        double halfChord = chord / 2;
        if (chord == 0 || halfChord > radius + CHORD_TOLERANCE) return List.of();

        double centerDistance = Math.sqrt(Math.max(0, radius * radius - halfChord * halfChord));
        double midX = (start.x + end.x) / 2;
        double midY = (start.y + end.y) / 2;

        double px;
        double py;
        if (Math.abs(dx) > MIN_CHORD_COMPONENT) {
            px = -dy / chord;
            py = dx / chord;
        } else {
            px = 1;
            py = 0;
        }
        return List.of(
                new Coordinate(midX + px * centerDistance, midY + py * centerDistance),
                new Coordinate(midX - px * centerDistance, midY - py * centerDistance));
    }

    /**
     * Greedy clustering against each cluster's first member; the first largest cluster wins.
     */
    private List<Coordinate> largestCluster(List<Coordinate> candidates) {
        double tol = options.arcCenterTolerance();
        List<List<Coordinate>> clusters = new ArrayList<>();
        for (Coordinate c : candidates) {
            List<Coordinate> home = null;
            for (List<Coordinate> cluster : clusters) {
                Coordinate seed = cluster.get(0);
                if (Math.abs(c.x - seed.x) < tol && Math.abs(c.y - seed.y) < tol) {
                    home = cluster;
                    break;
                }
            }
            if (home == null) {
                home = new ArrayList<>();
                clusters.add(home);
            }
            home.add(c);
        }

        List<Coordinate> best = clusters.get(0);
        for (List<Coordinate> cluster : clusters) {
            if (cluster.size() > best.size()) best = cluster;
        }
        return best;
    }

    /**
     * Coarse angular extent of one arc: 180 degrees for a large arc, 90 for any other.
     */
    static double estimateCoverageDegrees(ArcPrimitive arc) {
        return arc.largeArcFlag() == 1 ? 180 : 90;
    }

    private static Coordinate mean(List<Coordinate> points) {
        double x = 0;
        double y = 0;
        for (Coordinate p : points) {
            x += p.x;
            y += p.y;
        }
        return new Coordinate(x / points.size(), y / points.size());
    }

    private record GroupKey(GeometryClass geometryClass, long radiusThousandths) {

        static GroupKey of(ArcPrimitive arc) {
            return new GroupKey(arc.geometryClass(), Math.round(arc.radius() * 1000));
        }

        double radius() {
            return radiusThousandths / 1000.0;
        }
    }
}
