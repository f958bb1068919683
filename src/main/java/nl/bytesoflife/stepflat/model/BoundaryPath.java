package nl.bytesoflife.stepflat.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered outline points in the projection plane. A closed path does not repeat its first point.
 */
public record BoundaryPath(List<Coordinate> points, boolean closed) {

    public BoundaryPath {
        points = List.copyOf(points);
    }

    public static BoundaryPath closed(List<Coordinate> points) {
        return new BoundaryPath(points, true);
    }

    public int size() {
        return points.size();
    }

    public boolean isUsable() {
        return points.size() >= 3;
    }

    public Envelope envelope() {
        Envelope env = new Envelope();
        for (Coordinate p : points) {
            env.expandToInclude(p);
        }
        return env;
    }

    /**
     * Points as a closed ring, first point repeated at the end.
     */
    public Coordinate[] toRing() {
        List<Coordinate> ring = new ArrayList<>(points);
        if (!ring.isEmpty() && !ring.get(0).equals2D(ring.get(ring.size() - 1))) {
            ring.add(new Coordinate(ring.get(0)));
        }
        return ring.toArray(new Coordinate[0]);
    }
}
