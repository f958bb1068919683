package nl.bytesoflife.stepflat.export;

import nl.bytesoflife.stepflat.geometry.DegenerateNormalException;
import nl.bytesoflife.stepflat.geometry.FaceNormals;
import nl.bytesoflife.stepflat.geometry.MeshBoundaryExtractor;
import nl.bytesoflife.stepflat.geometry.PlaneProjector;
import nl.bytesoflife.stepflat.geometry.ProjectionBasis;
import nl.bytesoflife.stepflat.kernel.CurveEvaluationException;
import nl.bytesoflife.stepflat.kernel.Face;
import nl.bytesoflife.stepflat.kernel.Triangulation;
import nl.bytesoflife.stepflat.kernel.Wire;
import nl.bytesoflife.stepflat.model.BoundaryPath;
import nl.bytesoflife.stepflat.model.GeometryClass;
import nl.bytesoflife.stepflat.model.PolylinePrimitive;
import nl.bytesoflife.stepflat.model.Primitive;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Converts one face into drawing primitives.
 * <p>
 * The exact stage walks the face's wires; if that yields nothing the face's triangulation is
 * outlined; if that also fails a placeholder square is emitted, so export never fails on geometry.
 */
public class FaceExporter {

    private static final Logger log = LoggerFactory.getLogger(FaceExporter.class);

    private final ExportOptions options;
    private final PlaneProjector projector = new PlaneProjector();
    private final WireClassifier wireClassifier = new WireClassifier();
    private final EdgeClassifier edgeClassifier;
    private final ArcConsolidator arcConsolidator;
    private final MeshBoundaryExtractor meshExtractor;

    public FaceExporter() {
        this(ExportOptions.defaults());
    }

    public FaceExporter(ExportOptions options) {
        this.options = options;
        this.edgeClassifier = new EdgeClassifier(options);
        this.arcConsolidator = new ArcConsolidator(options);
        this.meshExtractor = new MeshBoundaryExtractor(options.duplicatePointTolerance());
    }

    public FaceExport export(int faceId, Face face) {
        List<String> notes = new ArrayList<>();

        StageResult<ProjectionBasis> basis = basisFor(face);
        if (basis.isSuccess()) {
            StageResult<ExactGeometry> exact = attemptExact(face, basis.value());
            if (exact.isSuccess()) {
                ExactGeometry geometry = exact.value();
                log.info("Face {}: {} entities from {} wires", faceId, geometry.primitives().size(), geometry.wireCount());
                return new FaceExport(faceId, face.surfaceKind(), ExportStage.EXACT,
                        geometry.primitives(), geometry.wireCount(), notes);
            }
            notes.add("exact: " + exact.describe());
            log.info("Face {}: exact curves unavailable ({}), falling back to mesh", faceId, exact.describe());

            StageResult<BoundaryPath> mesh = attemptMesh(face, basis.value());
            if (mesh.isSuccess()) {
                PolylinePrimitive outline = new PolylinePrimitive(mesh.value().points(), true, GeometryClass.BOUNDARY);
                log.info("Face {}: mesh boundary with {} points", faceId, mesh.value().size());
                return new FaceExport(faceId, face.surfaceKind(), ExportStage.MESH, List.of(outline), 1, notes);
            }
            notes.add("mesh: " + mesh.describe());
        } else {
            notes.add("basis: " + basis.describe());
        }

        log.warn("Face {}: no usable geometry, emitting placeholder ({})", faceId, String.join("; ", notes));
        PolylinePrimitive square = new PolylinePrimitive(placeholderSquare(options.placeholderSize()), true,
                GeometryClass.BOUNDARY);
        return new FaceExport(faceId, face.surfaceKind(), ExportStage.DEFAULT, List.of(square), 1, notes);
    }

    StageResult<ProjectionBasis> basisFor(Face face) {
        try {
            return StageResult.success(projector.computeBasis(FaceNormals.resolve(face)));
        } catch (DegenerateNormalException e) {
            return StageResult.failure(ExportFailure.DEGENERATE_NORMAL, e.getMessage());
        }
    }

    StageResult<ExactGeometry> attemptExact(Face face, ProjectionBasis basis) {
        List<Wire> wires;
        try {
            wires = face.wires();
        } catch (CurveEvaluationException e) {
            return StageResult.failure(ExportFailure.KERNEL_ERROR, e.getMessage());
        }
        if (wires == null || wires.isEmpty()) {
            return StageResult.failure(ExportFailure.NO_GEOMETRY_FOUND, "face has no wires");
        }

        List<Primitive> primitives = new ArrayList<>();
        int skipped = 0;
        for (WireClassifier.ClassifiedWire wire : wireClassifier.classify(wires)) {
            try {
                EdgeClassifier.Classification classification =
                        edgeClassifier.classify(wire.wire(), basis, wire.role());
                primitives.addAll(classification.primitives());
                skipped += classification.skippedEdges();
            } catch (CurveEvaluationException e) {
                log.warn("Skipping wire {}: {}", wire.index() + 1, e.getMessage());
            }
        }
        if (primitives.isEmpty()) {
            return StageResult.failure(ExportFailure.CURVE_EVALUATION, skipped + " edges skipped");
        }
        List<Primitive> ordered = new ArrayList<>(arcConsolidator.consolidate(primitives));
        // stable, so wire order is kept within each class
        ordered.sort(Comparator.comparing(Primitive::geometryClass));
        return StageResult.success(new ExactGeometry(ordered, wires.size(), skipped));
    }

    StageResult<BoundaryPath> attemptMesh(Face face, ProjectionBasis basis) {
        Triangulation mesh;
        try {
            mesh = face.triangulation();
        } catch (CurveEvaluationException e) {
            return StageResult.failure(ExportFailure.KERNEL_ERROR, e.getMessage());
        }
        if (mesh == null || mesh.vertices().size() < 3) {
            return StageResult.failure(ExportFailure.NO_GEOMETRY_FOUND, "mesh has fewer than 3 vertices");
        }

        List<Coordinate> points = projector.project(mesh.vertices(), basis);
        BoundaryPath boundary = meshExtractor.extract(points, mesh.triangles());
        if (!boundary.isUsable()) {
            return StageResult.failure(ExportFailure.BOUNDARY_RECONSTRUCTION, boundary.size() + " points");
        }
        return StageResult.success(boundary);
    }

    static List<Coordinate> placeholderSquare(double size) {
        return List.of(new Coordinate(0, 0), new Coordinate(size, 0),
                new Coordinate(size, size), new Coordinate(0, size));
    }

    /**
     * Primitives of the exact stage, the wire count and how many edges were skipped.
     */
    record ExactGeometry(List<Primitive> primitives, int wireCount, int skippedEdges) {
    }
}
