package nl.bytesoflife.stepflat.export;

import nl.bytesoflife.stepflat.kernel.Wire;
import nl.bytesoflife.stepflat.kernel.memory.MemoryWire;
import nl.bytesoflife.stepflat.kernel.memory.ParametricEdge;
import nl.bytesoflife.stepflat.model.GeometryClass;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WireClassifierTest {

    private final WireClassifier classifier = new WireClassifier();

    @Test
    void longestWireIsTheBoundary() {
        List<Wire> wires = List.of(square(10), square(2.5), square(2));

        List<WireClassifier.ClassifiedWire> result = classifier.classify(wires);

        assertEquals(40, result.get(0).length(), 1e-9);
        assertEquals(GeometryClass.BOUNDARY, result.get(0).role());
        assertEquals(GeometryClass.HOLE, result.get(1).role());
        assertEquals(GeometryClass.HOLE, result.get(2).role());
    }

    @Test
    void boundaryNeedNotComeFirst() {
        List<WireClassifier.ClassifiedWire> result = classifier.classify(List.of(square(2), square(10), square(2.5)));

        assertFalse(result.get(0).isBoundary());
        assertTrue(result.get(1).isBoundary());
        assertFalse(result.get(2).isBoundary());
    }

    @Test
    void equalLengthsPickTheLastWire() {
        List<WireClassifier.ClassifiedWire> result = classifier.classify(List.of(square(5), square(5)));

        assertEquals(GeometryClass.HOLE, result.get(0).role());
        assertEquals(GeometryClass.BOUNDARY, result.get(1).role());
    }

    @Test
    void unmeasurableWireCountsAsZero() {
        MemoryWire broken = MemoryWire.of(new ParametricEdge(t -> null, 0, 1));

        List<WireClassifier.ClassifiedWire> result = classifier.classify(List.of(broken, square(1)));

        assertEquals(0, result.get(0).length());
        assertEquals(GeometryClass.BOUNDARY, result.get(1).role());
    }

    @Test
    void exactlyOneBoundary() {
        List<WireClassifier.ClassifiedWire> result = classifier.classify(
                List.of(square(1), square(3), square(3), square(2)));

        assertEquals(1, result.stream().filter(WireClassifier.ClassifiedWire::isBoundary).count());
    }

    private static MemoryWire square(double side) {
        return MemoryWire.polygon(0, 0, 0, side, 0, side, side, 0, side);
    }
}
