package nl.bytesoflife.stepflat.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

public record LinePrimitive(Coordinate p1, Coordinate p2, GeometryClass geometryClass) implements Primitive {

    @Override
    public Envelope envelope() {
        return new Envelope(p1, p2);
    }

    public double length() {
        return p1.distance(p2);
    }
}
