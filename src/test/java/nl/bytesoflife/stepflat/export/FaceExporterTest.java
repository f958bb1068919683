package nl.bytesoflife.stepflat.export;

import nl.bytesoflife.stepflat.kernel.Face;
import nl.bytesoflife.stepflat.kernel.SurfaceKind;
import nl.bytesoflife.stepflat.kernel.memory.CircleEdge;
import nl.bytesoflife.stepflat.kernel.memory.EllipseEdge;
import nl.bytesoflife.stepflat.kernel.memory.MemoryFace;
import nl.bytesoflife.stepflat.kernel.memory.MemoryWire;
import nl.bytesoflife.stepflat.kernel.memory.ParametricEdge;
import nl.bytesoflife.stepflat.model.CirclePrimitive;
import nl.bytesoflife.stepflat.model.GeometryClass;
import nl.bytesoflife.stepflat.model.LinePrimitive;
import nl.bytesoflife.stepflat.model.PolylinePrimitive;
import nl.bytesoflife.stepflat.model.Primitive;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FaceExporterTest {

    private static final double[] SQUARE_MESH = {
            -10, -10, 0,
            10, -10, 0,
            10, 10, 0,
            -10, 10, 0
    };
    private static final int[] SQUARE_TRIANGLES = {0, 1, 2, 0, 2, 3};

    private final FaceExporter exporter = new FaceExporter();

    @Test
    void plateWithRoundHoleUsesExactCurves() {
        Face face = MemoryFace.builder()
                .normal(0, 0, 1)
                .wire(MemoryWire.of(CircleEdge.fullCircle(0, 0, 0, 2)))
                .wire(MemoryWire.polygon(0, -10, -10, 10, -10, 10, 10, -10, 10))
                .build();

        FaceExport export = exporter.export(3, face);

        assertEquals(ExportStage.EXACT, export.stage());
        assertEquals(3, export.faceId());
        assertEquals(2, export.wireCount());
        assertEquals(5, export.entityCount());
        assertTrue(export.notes().isEmpty());

        long boundaryLines = export.primitives().stream()
                .filter(p -> p instanceof LinePrimitive && p.geometryClass() == GeometryClass.BOUNDARY)
                .count();
        assertEquals(4, boundaryLines);

        CirclePrimitive hole = export.primitives().stream()
                .filter(p -> p instanceof CirclePrimitive)
                .map(p -> (CirclePrimitive) p)
                .findFirst()
                .orElseThrow();
        assertEquals(GeometryClass.HOLE, hole.geometryClass());
        assertEquals(2, hole.radius(), 1e-9);

        for (int i = 0; i < 4; i++) {
            assertEquals(GeometryClass.BOUNDARY, export.primitives().get(i).geometryClass());
        }
        assertSame(hole, export.primitives().get(4));
    }

    @Test
    void malformedCurvesDoNotAbortTheFace() {
        Face face = MemoryFace.builder()
                .normal(0, 0, 1)
                .wire(MemoryWire.polygon(0, -10, -10, 10, -10, 10, 10, -10, 10))
                .wire(MemoryWire.of(CircleEdge.fullCircle(0, 0, 0, 0)))
                .wire(MemoryWire.of(EllipseEdge.inXyPlane(4, 4, 0, 1, 2, 0, 2 * Math.PI)))
                .build();

        FaceExport export = assertDoesNotThrow(() -> exporter.export(1, face));

        assertEquals(ExportStage.EXACT, export.stage());
        assertEquals(3, export.wireCount());
        assertEquals(5, export.entityCount());
        PolylinePrimitive ellipse = assertInstanceOf(PolylinePrimitive.class, export.primitives().get(4));
        assertEquals(GeometryClass.HOLE, ellipse.geometryClass());
    }

    @Test
    void xyFaceKeepsItsCoordinates() {
        Face face = MemoryFace.builder()
                .normal(0, 0, 1)
                .wire(MemoryWire.polygon(0, -10, -10, 10, -10, 10, 10, -10, 10))
                .build();

        FaceExport export = exporter.export(0, face);

        LinePrimitive first = (LinePrimitive) export.primitives().get(0);
        assertEquals(-10, first.p1().x, 1e-6);
        assertEquals(-10, first.p1().y, 1e-6);
        assertEquals(10, first.p2().x, 1e-6);
        assertEquals(-10, first.p2().y, 1e-6);
    }

    @Test
    void faceWithoutWiresFallsBackToMesh() {
        Face face = MemoryFace.builder().mesh(SQUARE_MESH, SQUARE_TRIANGLES).build();

        FaceExport export = exporter.export(0, face);

        assertEquals(ExportStage.MESH, export.stage());
        assertEquals(1, export.wireCount());
        assertEquals(1, export.entityCount());
        PolylinePrimitive outline = assertInstanceOf(PolylinePrimitive.class, export.primitives().get(0));
        assertTrue(outline.closed());
        assertEquals(4, outline.points().size());
        assertEquals(1, export.notes().size());
        assertTrue(export.notes().get(0).startsWith("exact: " + ExportFailure.NO_GEOMETRY_FOUND.getDescription()));
    }

    @Test
    void unreadableCurvesFallBackToMesh() {
        ParametricEdge broken = new ParametricEdge(t -> null, 0, 1);
        Face face = MemoryFace.builder()
                .wire(MemoryWire.of(broken))
                .mesh(SQUARE_MESH, SQUARE_TRIANGLES)
                .build();

        FaceExport export = exporter.export(0, face);

        assertEquals(ExportStage.MESH, export.stage());
        assertTrue(export.notes().get(0).contains(ExportFailure.CURVE_EVALUATION.getDescription()));
    }

    @Test
    void emptyFaceGetsPlaceholderSquare() {
        Face face = MemoryFace.builder().surfaceKind(SurfaceKind.UNKNOWN).build();

        FaceExport export = exporter.export(1, face);

        assertEquals(ExportStage.DEFAULT, export.stage());
        assertEquals(SurfaceKind.UNKNOWN, export.surfaceKind());
        List<Primitive> primitives = export.primitives();
        assertEquals(1, primitives.size());
        PolylinePrimitive square = assertInstanceOf(PolylinePrimitive.class, primitives.get(0));
        assertTrue(square.closed());
        assertEquals(List.of(new Coordinate(0, 0), new Coordinate(10, 0), new Coordinate(10, 10), new Coordinate(0, 10)),
                square.points());
        assertEquals(2, export.notes().size());
    }

    @Test
    void collinearMeshGetsPlaceholderSquare() {
        Face face = MemoryFace.builder()
                .normal(0, 0, 1)
                .mesh(new double[]{0, 0, 0, 1, 0, 0, 2, 0, 0}, new int[0])
                .build();

        FaceExport export = exporter.export(0, face);

        assertEquals(ExportStage.DEFAULT, export.stage());
        assertTrue(export.notes().get(1).contains(ExportFailure.BOUNDARY_RECONSTRUCTION.getDescription()));
    }

    @Test
    void envelopeCoversAllPrimitives() {
        Face face = MemoryFace.builder()
                .normal(0, 0, 1)
                .wire(MemoryWire.polygon(0, 0, 0, 30, 0, 30, 20, 0, 20))
                .build();

        FaceExport export = exporter.export(0, face);

        assertEquals(30, export.envelope().getWidth(), 1e-9);
        assertEquals(20, export.envelope().getHeight(), 1e-9);
    }
}
