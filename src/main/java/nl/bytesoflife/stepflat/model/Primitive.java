package nl.bytesoflife.stepflat.model;

import org.locationtech.jts.geom.Envelope;

/**
 * A 2D vector shape handed to drawing writers.
 */
public interface Primitive {

    GeometryClass geometryClass();

    /**
     * Extent of the shape in the projection plane.
     */
    Envelope envelope();
}
