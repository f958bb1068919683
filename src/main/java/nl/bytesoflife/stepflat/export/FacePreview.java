package nl.bytesoflife.stepflat.export;

import nl.bytesoflife.stepflat.model.Primitive;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * Lightweight outline of a face for display before export. Coordinates are rounded to three
 * decimals and the boundary repeats its first point at the end.
 */
public record FacePreview(int faceId, String faceType, List<Coordinate> boundary, List<Primitive> holes,
                          double width, double height, Envelope bounds, boolean placeholder) {

    public FacePreview {
        boundary = List.copyOf(boundary);
        holes = List.copyOf(holes);
    }

    public int entityCount() {
        return 1 + holes.size();
    }
}
