package nl.bytesoflife.stepflat.export;

import nl.bytesoflife.stepflat.kernel.Face;
import nl.bytesoflife.stepflat.kernel.SurfaceKind;
import nl.bytesoflife.stepflat.kernel.memory.MemoryFace;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FacePreviewBuilderTest {

    private final FacePreviewBuilder builder = new FacePreviewBuilder();

    @Test
    void squareMeshPreview() {
        Face face = MemoryFace.builder()
                .mesh(new double[]{-5, -5, 0, 15, -5, 0, 15, 15, 0, -5, 15, 0}, new int[]{0, 1, 2, 0, 2, 3})
                .build();

        FacePreview preview = builder.build(2, face);

        assertFalse(preview.placeholder());
        assertEquals(2, preview.faceId());
        assertEquals("Plane", preview.faceType());
        assertEquals(5, preview.boundary().size());
        assertEquals(preview.boundary().get(0), preview.boundary().get(4));
        assertEquals(20, preview.width(), 1e-9);
        assertEquals(20, preview.height(), 1e-9);
        assertEquals(-5, preview.bounds().getMinX(), 1e-9);
        assertEquals(15, preview.bounds().getMaxY(), 1e-9);
        assertTrue(preview.holes().isEmpty());
        assertEquals(1, preview.entityCount());
    }

    @Test
    void coordinatesAreRoundedToThreeDecimals() {
        Face face = MemoryFace.builder()
                .mesh(new double[]{0.12345, 0, 0, 1.98765, 0, 0, 0, 1.00049, 0}, new int[]{0, 1, 2})
                .build();

        FacePreview preview = builder.build(0, face);

        assertTrue(preview.boundary().contains(new Coordinate(0.123, 0)));
        assertTrue(preview.boundary().contains(new Coordinate(1.988, 0)));
        assertTrue(preview.boundary().contains(new Coordinate(0, 1.0)));
    }

    @Test
    void emptyMeshGetsPlaceholder() {
        Face face = MemoryFace.builder().surfaceKind(SurfaceKind.CURVED).build();

        FacePreview preview = builder.build(0, face);

        assertTrue(preview.placeholder());
        assertEquals("Curved", preview.faceType());
        assertEquals(List.of(new Coordinate(0, 0), new Coordinate(10, 0), new Coordinate(10, 10),
                new Coordinate(0, 10), new Coordinate(0, 0)), preview.boundary());
        assertEquals(10, preview.width());
        assertEquals(10, preview.height());
        assertEquals(1, preview.entityCount());
    }

    @Test
    void thinFaceHasMinimumExtent() {
        Face face = MemoryFace.builder()
                .normal(0, 0, 1)
                .mesh(new double[]{0, 0, 0, 10, 0, 0, 10, 0.01, 0, 0, 0.01, 0}, new int[]{0, 1, 2, 0, 2, 3})
                .build();

        FacePreview preview = builder.build(0, face);

        assertEquals(10, preview.width(), 1e-9);
        assertEquals(0.1, preview.height(), 1e-9);
    }
}
