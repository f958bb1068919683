package nl.bytesoflife.stepflat.model;

import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * Interior mesh points assumed to lie on one hole outline.
 */
public record HoleCluster(List<Coordinate> points, double seedDistance) {

    public HoleCluster {
        points = List.copyOf(points);
    }

    public Coordinate centroid() {
        double sx = 0;
        double sy = 0;
        for (Coordinate p : points) {
            sx += p.x;
            sy += p.y;
        }
        return new Coordinate(sx / points.size(), sy / points.size());
    }

    public double meanRadius() {
        Coordinate c = centroid();
        double sum = 0;
        for (Coordinate p : points) {
            sum += p.distance(c);
        }
        return sum / points.size();
    }

    public int size() {
        return points.size();
    }
}
