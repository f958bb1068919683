package nl.bytesoflife.stepflat.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

public record PolylinePrimitive(List<Coordinate> points, boolean closed, GeometryClass geometryClass)
        implements Primitive {

    public PolylinePrimitive {
        if (points.size() < 2) {
            throw new IllegalArgumentException("Polyline needs at least two points, got " + points.size());
        }
        points = List.copyOf(points);
    }

    @Override
    public Envelope envelope() {
        Envelope env = new Envelope();
        for (Coordinate p : points) {
            env.expandToInclude(p);
        }
        return env;
    }
}
