package nl.bytesoflife.stepflat.export;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import static org.junit.jupiter.api.Assertions.*;

class ArcDirectionResolverTest {

    private final ArcDirectionResolver resolver = new ArcDirectionResolver();

    @Test
    void quarterArcCounterClockwise() {
        ArcDirection arc = resolver.resolveAngles(0, 90, 45);

        assertTrue(arc.isCounterClockwise());
        assertEquals(1, arc.sweepFlag());
        assertEquals(0, arc.largeArcFlag());
        assertEquals(90, arc.angleDiff(), 1e-9);
        assertEquals(0, arc.startAngle(), 1e-9);
        assertEquals(90, arc.endAngle(), 1e-9);
    }

    @Test
    void counterClockwiseAcrossZero() {
        ArcDirection arc = resolver.resolveAngles(350, 10, 0);

        assertTrue(arc.isCounterClockwise());
        assertEquals(20, arc.angleDiff(), 1e-9);
        assertEquals(0, arc.largeArcFlag());
    }

    @Test
    void clockwiseArcSwapsStoredAngles() {
        ArcDirection arc = resolver.resolveAngles(90, 0, 45);

        assertFalse(arc.isCounterClockwise());
        assertEquals(0, arc.sweepFlag());
        assertEquals(90, arc.angleDiff(), 1e-9);
        assertEquals(0, arc.startAngle(), 1e-9);
        assertEquals(90, arc.endAngle(), 1e-9);
    }

    @Test
    void largeArc() {
        ArcDirection arc = resolver.resolveAngles(0, 270, 135);

        assertTrue(arc.isCounterClockwise());
        assertEquals(1, arc.largeArcFlag());
        assertEquals(270, arc.angleDiff(), 1e-9);
    }

    @Test
    void largeClockwiseArc() {
        ArcDirection arc = resolver.resolveAngles(0, 90, 200);

        assertFalse(arc.isCounterClockwise());
        assertEquals(1, arc.largeArcFlag());
        assertEquals(270, arc.angleDiff(), 1e-9);
    }

    @Test
    void negativeAnglesAreNormalized() {
        ArcDirection arc = resolver.resolveAngles(-10, 10, 0);

        assertEquals(350, arc.startAngle(), 1e-9);
        assertEquals(20, arc.angleDiff(), 1e-9);
    }

    @Test
    void pointsAroundCenter() {
        Coordinate center = new Coordinate(1, 1);
        ArcDirection arc = resolver.resolve(center, new Coordinate(3, 1), new Coordinate(1, 3),
                new Coordinate(1 + Math.sqrt(2), 1 + Math.sqrt(2)));

        assertTrue(arc.isCounterClockwise());
        assertEquals(90, arc.angleDiff(), 1e-9);
    }

    @Test
    void normalizeDegrees() {
        assertEquals(0, ArcDirectionResolver.normalizeDegrees(360), 1e-12);
        assertEquals(270, ArcDirectionResolver.normalizeDegrees(-90), 1e-12);
        assertEquals(30, ArcDirectionResolver.normalizeDegrees(750), 1e-12);
        assertTrue(ArcDirectionResolver.normalizeDegrees(-1e-15) < 360);
    }
}
