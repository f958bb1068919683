package nl.bytesoflife.stepflat.model;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrimitiveTest {

    @Test
    void smallArcEnvelopeSpansEndPoints() {
        ArcPrimitive arc = new ArcPrimitive(new Coordinate(0, 0), 2, new Coordinate(2, 0), new Coordinate(0, 2),
                0, 90, 1, 0, GeometryClass.BOUNDARY);

        assertEquals(new Envelope(0, 2, 0, 2), arc.envelope());
        assertTrue(arc.isCounterClockwise());
    }

    @Test
    void smallArcEnvelopeIncludesPassedExtremes() {
        double s = Math.sqrt(2);
        ArcPrimitive arc = new ArcPrimitive(new Coordinate(0, 0), 2, new Coordinate(s, s), new Coordinate(-s, s),
                45, 135, 1, 0, GeometryClass.BOUNDARY);

        Envelope env = arc.envelope();

        assertEquals(2, env.getMaxY(), 1e-12);
        assertEquals(s, env.getMinY(), 1e-12);
        assertEquals(-s, env.getMinX(), 1e-12);
        assertEquals(s, env.getMaxX(), 1e-12);
    }

    @Test
    void clockwiseArcEnvelopeFollowsStoredAngles() {
        ArcPrimitive arc = new ArcPrimitive(new Coordinate(0, 0), 1, new Coordinate(0, -1), new Coordinate(0, 1),
                270, 90, 0, 0, GeometryClass.HOLE);

        Envelope env = arc.envelope();

        assertEquals(0, env.getMinX(), 1e-12);
        assertEquals(1, env.getMaxX(), 1e-12);
        assertEquals(-1, env.getMinY(), 1e-12);
        assertEquals(1, env.getMaxY(), 1e-12);
    }

    @Test
    void largeArcEnvelopeCoversWholeCircle() {
        ArcPrimitive arc = new ArcPrimitive(new Coordinate(1, 1), 2, new Coordinate(3, 1), new Coordinate(1, 3),
                90, 0, 0, 1, GeometryClass.HOLE);

        assertEquals(new Envelope(-1, 3, -1, 3), arc.envelope());
        assertFalse(arc.isCounterClockwise());
    }

    @Test
    void ellipseRadiiAndRotation() {
        EllipsePrimitive ellipse = new EllipsePrimitive(new Coordinate(0, 0), new Coordinate(3, 3), 0.5,
                GeometryClass.BOUNDARY);

        assertEquals(Math.sqrt(18), ellipse.majorRadius(), 1e-12);
        assertEquals(Math.sqrt(18) / 2, ellipse.minorRadius(), 1e-12);
        assertEquals(45, ellipse.rotationDegrees(), 1e-9);
    }

    @Test
    void boundaryRingIsClosedOnce() {
        BoundaryPath open = BoundaryPath.closed(List.of(new Coordinate(0, 0), new Coordinate(1, 0),
                new Coordinate(1, 1)));
        assertEquals(4, open.toRing().length);
        assertTrue(open.toRing()[3].equals2D(new Coordinate(0, 0)));

        BoundaryPath repeated = BoundaryPath.closed(List.of(new Coordinate(0, 0), new Coordinate(1, 0),
                new Coordinate(1, 1), new Coordinate(0, 0)));
        assertEquals(4, repeated.toRing().length);
    }

    @Test
    void boundaryNeedsThreePoints() {
        assertFalse(BoundaryPath.closed(List.of(new Coordinate(0, 0), new Coordinate(1, 0))).isUsable());
        assertEquals(new Envelope(0, 1, 0, 0),
                BoundaryPath.closed(List.of(new Coordinate(0, 0), new Coordinate(1, 0))).envelope());
    }

    @Test
    void holeClusterCentroidAndRadius() {
        HoleCluster cluster = new HoleCluster(List.of(new Coordinate(1, 0), new Coordinate(-1, 0),
                new Coordinate(0, 1), new Coordinate(0, -1)), 1.4);

        assertTrue(cluster.centroid().equals2D(new Coordinate(0, 0)));
        assertEquals(1.0, cluster.meanRadius(), 1e-12);
        assertEquals(4, cluster.size());
    }

    @Test
    void lineLength() {
        assertEquals(5, new LinePrimitive(new Coordinate(0, 0), new Coordinate(3, 4), GeometryClass.BOUNDARY).length());
    }
}
