package nl.bytesoflife.stepflat.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

public record CirclePrimitive(Coordinate center, double radius, GeometryClass geometryClass) implements Primitive {

    @Override
    public Envelope envelope() {
        return new Envelope(center.x - radius, center.x + radius, center.y - radius, center.y + radius);
    }
}
