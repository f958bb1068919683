package nl.bytesoflife.stepflat.export;

import nl.bytesoflife.stepflat.geometry.FaceNormals;
import nl.bytesoflife.stepflat.geometry.HoleDetectionOptions;
import nl.bytesoflife.stepflat.geometry.HoleDetector;
import nl.bytesoflife.stepflat.geometry.MeshBoundaryExtractor;
import nl.bytesoflife.stepflat.geometry.PlaneProjector;
import nl.bytesoflife.stepflat.geometry.ProjectionBasis;
import nl.bytesoflife.stepflat.kernel.CurveEvaluationException;
import nl.bytesoflife.stepflat.kernel.Face;
import nl.bytesoflife.stepflat.kernel.Triangulation;
import nl.bytesoflife.stepflat.model.BoundaryPath;
import nl.bytesoflife.stepflat.model.CirclePrimitive;
import nl.bytesoflife.stepflat.model.GeometryClass;
import nl.bytesoflife.stepflat.model.PolylinePrimitive;
import nl.bytesoflife.stepflat.model.Primitive;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds previews from a face's triangulation: the mesh outline plus holes detected among the
 * interior mesh points.
 */
public class FacePreviewBuilder {

    private static final Logger log = LoggerFactory.getLogger(FacePreviewBuilder.class);

    private static final double MIN_EXTENT = 0.1;

    private final ExportOptions options;
    private final PlaneProjector projector = new PlaneProjector();
    private final MeshBoundaryExtractor meshExtractor;
    private final HoleDetector holeDetector;

    public FacePreviewBuilder() {
        this(ExportOptions.defaults(), HoleDetectionOptions.defaults());
    }

    public FacePreviewBuilder(ExportOptions options, HoleDetectionOptions holeOptions) {
        this.options = options;
        this.meshExtractor = new MeshBoundaryExtractor(options.duplicatePointTolerance());
        this.holeDetector = new HoleDetector(holeOptions);
    }

    public FacePreview build(int faceId, Face face) {
        String faceType = face.surfaceKind().getDisplayName();

        Triangulation mesh;
        try {
            mesh = face.triangulation();
        } catch (CurveEvaluationException e) {
            log.warn("Face {}: triangulation unavailable: {}", faceId, e.getMessage());
            return placeholder(faceId, faceType);
        }
        if (mesh == null || mesh.vertices().size() < 3) {
            return placeholder(faceId, faceType);
        }

        ProjectionBasis basis = projector.basisOrDefault(FaceNormals.resolve(face));
        List<Coordinate> points = projector.project(mesh.vertices(), basis);
        BoundaryPath boundary = meshExtractor.extract(points, mesh.triangles());
        if (!boundary.isUsable()) {
            return placeholder(faceId, faceType);
        }

        Envelope env = boundary.envelope();
        Envelope bounds = new Envelope(round(env.getMinX()), round(env.getMaxX()),
                round(env.getMinY()), round(env.getMaxY()));

        List<Primitive> holes = new ArrayList<>();
        for (Primitive hole : holeDetector.detect(points, boundary)) {
            holes.add(rounded(hole));
        }
        log.debug("Face {} preview: {} boundary points, {} holes", faceId, boundary.size(), holes.size());

        return new FacePreview(faceId, faceType, closedRounded(boundary.points()), holes,
                round(Math.max(env.getWidth(), MIN_EXTENT)), round(Math.max(env.getHeight(), MIN_EXTENT)),
                bounds, false);
    }

    private FacePreview placeholder(int faceId, String faceType) {
        double size = options.placeholderSize();
        return new FacePreview(faceId, faceType, closedRounded(FaceExporter.placeholderSquare(size)), List.of(),
                size, size, new Envelope(0, size, 0, size), true);
    }

    private static Primitive rounded(Primitive hole) {
        if (hole instanceof CirclePrimitive circle) {
            return new CirclePrimitive(round(circle.center()), round(circle.radius()), GeometryClass.HOLE);
        }
        if (hole instanceof PolylinePrimitive polyline) {
            return new PolylinePrimitive(closedRounded(polyline.points()), true, GeometryClass.HOLE);
        }
        return hole;
    }

    static List<Coordinate> closedRounded(List<Coordinate> points) {
        List<Coordinate> result = new ArrayList<>(points.size() + 1);
        for (Coordinate p : points) {
            result.add(round(p));
        }
        if (!result.isEmpty() && !result.get(0).equals2D(result.get(result.size() - 1))) {
            result.add(new Coordinate(result.get(0)));
        }
        return result;
    }

    static Coordinate round(Coordinate p) {
        return new Coordinate(round(p.x), round(p.y));
    }

    static double round(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
