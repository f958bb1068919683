package nl.bytesoflife.stepflat.export;

import nl.bytesoflife.stepflat.geometry.ProjectionBasis;
import nl.bytesoflife.stepflat.kernel.CircleGeometry;
import nl.bytesoflife.stepflat.kernel.CurveEvaluationException;
import nl.bytesoflife.stepflat.kernel.Edge;
import nl.bytesoflife.stepflat.kernel.EllipseGeometry;
import nl.bytesoflife.stepflat.kernel.Wire;
import nl.bytesoflife.stepflat.model.ArcPrimitive;
import nl.bytesoflife.stepflat.model.CirclePrimitive;
import nl.bytesoflife.stepflat.model.EllipsePrimitive;
import nl.bytesoflife.stepflat.model.GeometryClass;
import nl.bytesoflife.stepflat.model.LinePrimitive;
import nl.bytesoflife.stepflat.model.PolylinePrimitive;
import nl.bytesoflife.stepflat.model.Primitive;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns the edges of a wire into 2D primitives in a face's projection plane.
 */
public class EdgeClassifier {

    private static final Logger log = LoggerFactory.getLogger(EdgeClassifier.class);

    private final ExportOptions options;
    private final ArcDirectionResolver arcResolver = new ArcDirectionResolver();

    public EdgeClassifier() {
        this(ExportOptions.defaults());
    }

    public EdgeClassifier(ExportOptions options) {
        this.options = options;
    }

    /**
     * Classifies every edge of the wire. An edge whose curve cannot be evaluated is skipped.
     */
    public Classification classify(Wire wire, ProjectionBasis basis, GeometryClass geometryClass) {
        List<Primitive> primitives = new ArrayList<>();
        List<Edge> edges = wire.edges();
        int skipped = 0;

        for (int i = 0; i < edges.size(); i++) {
            try {
                primitives.addAll(classifyEdge(edges.get(i), basis, geometryClass));
            } catch (CurveEvaluationException e) {
                skipped++;
                log.warn("Skipping edge {} of {}: {}", i + 1, edges.size(), e.getMessage());
            }
        }
        return new Classification(primitives, edges.size(), skipped);
    }

    public List<Primitive> classifyEdge(Edge edge, ProjectionBasis basis, GeometryClass geometryClass) {
        return switch (edge.curveKind()) {
            case LINE -> List.of(line(edge, basis, geometryClass));
            case CIRCLE -> circleOrArc(edge, basis, geometryClass);
            case ELLIPSE -> ellipse(edge, basis, geometryClass);
            case OTHER -> polyline(edge, basis, geometryClass, options.curveSamples());
        };
    }

    private LinePrimitive line(Edge edge, ProjectionBasis basis, GeometryClass geometryClass) {
        Coordinate p1 = basis.project(edge.valueAt(edge.first()));
        Coordinate p2 = basis.project(edge.valueAt(edge.last()));
        log.debug("LINE ({}) to ({}) [{}]", fmt(p1), fmt(p2), geometryClass.getTag());
        return new LinePrimitive(p1, p2, geometryClass);
    }

    private List<Primitive> circleOrArc(Edge edge, ProjectionBasis basis, GeometryClass geometryClass) {
        CircleGeometry circle;
        try {
            circle = edge.circle();
        } catch (CurveEvaluationException e) {
            log.warn("Circle data unavailable ({}), approximating with a polyline", e.getMessage());
            return polyline(edge, basis, geometryClass, options.secondaryCurveSamples());
        }
        Coordinate center = basis.project(circle.center());
        double radius = circle.radius();

        if (isFullTurn(edge.first(), edge.last())) {
            log.debug("CIRCLE center=({}) r={} [{}]", fmt(center), fmt(radius), geometryClass.getTag());
            return List.of(new CirclePrimitive(center, radius, geometryClass));
        }

        Coordinate start = basis.project(edge.valueAt(edge.first()));
        Coordinate end = basis.project(edge.valueAt(edge.last()));
        Coordinate mid = basis.project(edge.valueAt((edge.first() + edge.last()) / 2));
        ArcDirection direction = arcResolver.resolve(center, start, end, mid);

        log.debug("ARC center=({}) r={} angles={}-{} ccw={} large={} [{}]", fmt(center), fmt(radius),
                fmt(direction.startAngle()), fmt(direction.endAngle()),
                direction.isCounterClockwise(), direction.largeArcFlag(), geometryClass.getTag());
        return List.of(new ArcPrimitive(center, radius, start, end,
                direction.startAngle(), direction.endAngle(),
                direction.sweepFlag(), direction.largeArcFlag(), geometryClass));
    }

    private List<Primitive> ellipse(Edge edge, ProjectionBasis basis, GeometryClass geometryClass) {
        if (!isFullTurn(edge.first(), edge.last())) {
            return polyline(edge, basis, geometryClass, options.secondaryCurveSamples());
        }
        EllipseGeometry ellipse;
        try {
            ellipse = edge.ellipse();
        } catch (CurveEvaluationException e) {
            log.warn("Ellipse data unavailable ({}), approximating with a polyline", e.getMessage());
            return polyline(edge, basis, geometryClass, options.secondaryCurveSamples());
        }
        Coordinate center = basis.project(ellipse.center());
        Vector3D direction = ellipse.majorAxisDirection();
        // a direction projects without the translation part, i.e. by the same linear map
        Coordinate axis = basis.project(direction);
        double scale = ellipse.majorRadius() / Math.max(Math.hypot(axis.x, axis.y), 1e-12);
        Coordinate majorAxis = new Coordinate(axis.x * scale, axis.y * scale);

        log.debug("ELLIPSE center=({}) major={} minor={} [{}]", fmt(center),
                fmt(ellipse.majorRadius()), fmt(ellipse.minorRadius()), geometryClass.getTag());
        return List.of(new EllipsePrimitive(center, majorAxis, ellipse.ratio(), geometryClass));
    }

    private List<Primitive> polyline(Edge edge, ProjectionBasis basis, GeometryClass geometryClass, int samples) {
        List<Coordinate> points = new ArrayList<>(samples + 1);
        double first = edge.first();
        double last = edge.last();
        for (int i = 0; i <= samples; i++) {
            Coordinate p = basis.project(edge.valueAt(first + (last - first) * i / samples));
            if (points.isEmpty() || points.get(points.size() - 1).distance(p) > options.duplicatePointTolerance()) {
                points.add(p);
            }
        }
        if (points.size() < 2) {
            log.debug("Dropping degenerate {} edge", edge.curveKind());
            return List.of();
        }
        log.debug("POLYLINE approximation with {} points [{}]", points.size(), geometryClass.getTag());
        return List.of(new PolylinePrimitive(points, false, geometryClass));
    }

    boolean isFullTurn(double first, double last) {
        return Math.abs(Math.abs(last - first) - 2 * Math.PI) < options.fullTurnTolerance();
    }

    private static String fmt(Coordinate c) {
        return String.format(Locale.US, "%.2f,%.2f", c.x, c.y);
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.2f", v);
    }

    /**
     * Primitives of one wire plus how many of its edges had to be skipped.
     */
    public record Classification(List<Primitive> primitives, int edgeCount, int skippedEdges) {
    }
}
