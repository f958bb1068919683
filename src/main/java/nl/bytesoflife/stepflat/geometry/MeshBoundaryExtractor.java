package nl.bytesoflife.stepflat.geometry;

import nl.bytesoflife.stepflat.kernel.Triangle;
import nl.bytesoflife.stepflat.model.BoundaryPath;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recovers a face outline from its triangulation: edges used by exactly one triangle are chained into
 * a path. Falls back to the convex hull of the vertices when the mesh has no such edges.
 * Assumes a manifold mesh.
 */
public class MeshBoundaryExtractor {

    private static final Logger log = LoggerFactory.getLogger(MeshBoundaryExtractor.class);

    private final double duplicateTolerance;

    public MeshBoundaryExtractor() {
        this(0.001);
    }

    public MeshBoundaryExtractor(double duplicateTolerance) {
        this.duplicateTolerance = duplicateTolerance;
    }

    /**
     * Boundary outline of projected mesh vertices.
     */
    public BoundaryPath extract(List<Coordinate> vertices, List<Triangle> triangles) {
        if (!triangles.isEmpty()) {
            List<MeshEdge> boundaryEdges = findBoundaryEdges(triangles);
            log.debug("Found {} boundary edges from {} triangles", boundaryEdges.size(), triangles.size());
            if (!boundaryEdges.isEmpty()) {
                BoundaryPath path = edgesToPath(boundaryEdges, vertices);
                if (path.isUsable()) return path;
                log.debug("Boundary walk gave only {} points, using convex hull", path.size());
            }
        }
        return extractHull(vertices);
    }

    /**
     * Undirected edges that belong to exactly one triangle, in first-seen order.
     */
    public List<MeshEdge> findBoundaryEdges(List<Triangle> triangles) {
        Map<MeshEdge, Integer> edgeCount = new LinkedHashMap<>();
        for (Triangle t : triangles) {
            edgeCount.merge(MeshEdge.of(t.a(), t.b()), 1, Integer::sum);
            edgeCount.merge(MeshEdge.of(t.b(), t.c()), 1, Integer::sum);
            edgeCount.merge(MeshEdge.of(t.c(), t.a()), 1, Integer::sum);
        }

        List<MeshEdge> boundary = new ArrayList<>();
        for (Map.Entry<MeshEdge, Integer> entry : edgeCount.entrySet()) {
            if (entry.getValue() == 1) {
                boundary.add(entry.getKey());
            }
        }
        return boundary;
    }

    /**
     * Chains boundary edges into a single closed path, starting at the first vertex of degree two
     * or less. The walk ends when it returns to the start, reaches a dead end, or has taken
     * {@code edges.size() + 1} steps.
     */
    public BoundaryPath edgesToPath(List<MeshEdge> edges, List<Coordinate> vertices) {
        if (edges.isEmpty()) return BoundaryPath.closed(List.of());

        Map<Integer, List<Integer>> adjacency = new LinkedHashMap<>();
        for (MeshEdge edge : edges) {
            adjacency.computeIfAbsent(edge.a(), k -> new ArrayList<>()).add(edge.b());
            adjacency.computeIfAbsent(edge.b(), k -> new ArrayList<>()).add(edge.a());
        }

        Integer start = null;
        for (Map.Entry<Integer, List<Integer>> entry : adjacency.entrySet()) {
            if (entry.getValue().size() <= 2) {
                start = entry.getKey();
                break;
            }
        }
        if (start == null) {
            start = adjacency.keySet().iterator().next();
        }

        List<Integer> path = new ArrayList<>();
        path.add(start);
        int current = start;
        Integer previous = null;

        while (true) {
            Integer next = null;
            for (int neighbor : adjacency.get(current)) {
                if (previous == null || neighbor != previous) {
                    next = neighbor;
                    break;
                }
            }
            if (next == null) break;
            if (next.equals(start) && path.size() > 2) break;

            path.add(next);
            previous = current;
            current = next;

            if (path.size() > edges.size() + 1) {
                log.warn("Boundary walk exceeded {} steps, mesh topology is malformed", edges.size() + 1);
                break;
            }
        }

        List<Coordinate> points = new ArrayList<>(path.size());
        for (int index : path) {
            if (index >= 0 && index < vertices.size()) {
                points.add(vertices.get(index));
            }
        }
        return BoundaryPath.closed(points);
    }

    /**
     * Convex hull of the points after merging near-duplicates. With fewer than three distinct points
     * the input is returned unchanged.
     */
    public BoundaryPath extractHull(List<Coordinate> points) {
        if (points.size() < 3) return BoundaryPath.closed(points);

        List<Coordinate> unique = new ArrayList<>();
        for (Coordinate p : points) {
            boolean duplicate = false;
            for (Coordinate existing : unique) {
                if (Math.abs(p.x - existing.x) < duplicateTolerance
                        && Math.abs(p.y - existing.y) < duplicateTolerance) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) unique.add(p);
        }

        if (unique.size() < 3) return BoundaryPath.closed(points);
        return BoundaryPath.closed(convexHull(unique));
    }

    /**
     * Andrew's monotone chain. Returns the hull counter-clockwise, starting at the lowest-x point,
     * without repeating the first point; collinear points are dropped.
     */
    public List<Coordinate> convexHull(List<Coordinate> points) {
        List<Coordinate> sorted = new ArrayList<>();
        for (Coordinate p : points.stream().sorted().toList()) {
            if (sorted.isEmpty() || !sorted.get(sorted.size() - 1).equals2D(p)) {
                sorted.add(p);
            }
        }
        if (sorted.size() < 3) return sorted;

        List<Coordinate> lower = new ArrayList<>();
        for (Coordinate p : sorted) {
            while (lower.size() >= 2 && cross(lower.get(lower.size() - 2), lower.get(lower.size() - 1), p) <= 0) {
                lower.remove(lower.size() - 1);
            }
            lower.add(p);
        }

        List<Coordinate> upper = new ArrayList<>();
        for (int i = sorted.size() - 1; i >= 0; i--) {
            Coordinate p = sorted.get(i);
            while (upper.size() >= 2 && cross(upper.get(upper.size() - 2), upper.get(upper.size() - 1), p) <= 0) {
                upper.remove(upper.size() - 1);
            }
            upper.add(p);
        }

        List<Coordinate> hull = new ArrayList<>(lower.subList(0, lower.size() - 1));
        hull.addAll(upper.subList(0, upper.size() - 1));
        return hull;
    }

    private static double cross(Coordinate o, Coordinate a, Coordinate b) {
        return (a.x - o.x) * (b.y - o.y) - (a.y - o.y) * (b.x - o.x);
    }

    /**
     * Undirected mesh edge with {@code a <= b}.
     */
    public record MeshEdge(int a, int b) {

        public static MeshEdge of(int i, int j) {
            return new MeshEdge(Math.min(i, j), Math.max(i, j));
        }
    }
}
