package nl.bytesoflife.stepflat.writer;

import nl.bytesoflife.stepflat.export.FaceExport;
import nl.bytesoflife.stepflat.model.ArcPrimitive;
import nl.bytesoflife.stepflat.model.CirclePrimitive;
import nl.bytesoflife.stepflat.model.EllipsePrimitive;
import nl.bytesoflife.stepflat.model.GeometryClass;
import nl.bytesoflife.stepflat.model.LinePrimitive;
import nl.bytesoflife.stepflat.model.PolylinePrimitive;
import nl.bytesoflife.stepflat.model.Primitive;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a face as an SVG document sized in millimetres. The view box is the drawing's extent
 * padded by 10% of its larger side on every edge.
 */
public class SvgDrawingWriter implements DrawingWriter {

    private static final double PADDING_FRACTION = 0.1;

    private final Map<GeometryClass, LayerStyle> styles;

    public SvgDrawingWriter() {
        this(LayerStyle.defaults());
    }

    public SvgDrawingWriter(Map<GeometryClass, LayerStyle> styles) {
        this.styles = styles;
    }

    @Override
    public byte[] render(FaceExport export) {
        return toSvg(export).getBytes(StandardCharsets.UTF_8);
    }

    public String toSvg(FaceExport export) {
        Envelope env = export.envelope();
        double padding = Math.max(env.getWidth(), env.getHeight()) * PADDING_FRACTION;
        if (padding <= 0) padding = 1;
        double minX = env.getMinX() - padding;
        double minY = env.getMinY() - padding;
        double width = env.getWidth() + 2 * padding;
        double height = env.getHeight() + 2 * padding;

        StringBuilder svg = new StringBuilder();
        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        svg.append(String.format(Locale.US,
                "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%.3fmm\" height=\"%.3fmm\" viewBox=\"%.3f %.3f %.3f %.3f\">\n",
                width, height, minX, minY, width, height));
        svg.append("  <defs>\n    <style>\n");
        for (GeometryClass geometryClass : GeometryClass.values()) {
            LayerStyle style = styleFor(geometryClass);
            svg.append(String.format("      .%s { fill: none; stroke: %s; stroke-width: %s; }\n",
                    geometryClass.getTag(), style.strokeColor(), style.strokeWidth()));
        }
        svg.append("    </style>\n  </defs>\n");

        for (Primitive primitive : export.primitives()) {
            svg.append("  ").append(element(primitive)).append('\n');
        }
        svg.append("</svg>\n");
        return svg.toString();
    }

    static String element(Primitive primitive) {
        String cls = primitive.geometryClass().getTag();
        if (primitive instanceof LinePrimitive line) {
            return String.format(Locale.US, "<line x1=\"%.3f\" y1=\"%.3f\" x2=\"%.3f\" y2=\"%.3f\" class=\"%s\"/>",
                    line.p1().x, line.p1().y, line.p2().x, line.p2().y, cls);
        }
        if (primitive instanceof CirclePrimitive circle) {
            return String.format(Locale.US, "<circle cx=\"%.3f\" cy=\"%.3f\" r=\"%.3f\" class=\"%s\"/>",
                    circle.center().x, circle.center().y, circle.radius(), cls);
        }
        if (primitive instanceof ArcPrimitive arc) {
            return String.format(Locale.US, "<path d=\"M %.3f %.3f A %.3f %.3f 0 %d %d %.3f %.3f\" class=\"%s\"/>",
                    arc.start().x, arc.start().y, arc.radius(), arc.radius(),
                    arc.largeArcFlag(), arc.sweepFlag(), arc.end().x, arc.end().y, cls);
        }
        if (primitive instanceof EllipsePrimitive ellipse) {
            Coordinate c = ellipse.center();
            return String.format(Locale.US,
                    "<ellipse cx=\"%.3f\" cy=\"%.3f\" rx=\"%.3f\" ry=\"%.3f\" transform=\"rotate(%.3f %.3f %.3f)\" class=\"%s\"/>",
                    c.x, c.y, ellipse.majorRadius(), ellipse.minorRadius(), ellipse.rotationDegrees(), c.x, c.y, cls);
        }
        if (primitive instanceof PolylinePrimitive polyline) {
            StringBuilder points = new StringBuilder();
            for (Coordinate p : polyline.points()) {
                if (points.length() > 0) points.append(' ');
                points.append(String.format(Locale.US, "%.3f,%.3f", p.x, p.y));
            }
            String tag = polyline.closed() ? "polygon" : "polyline";
            return String.format("<%s points=\"%s\" class=\"%s\"/>", tag, points, cls);
        }
        throw new IllegalArgumentException("Unsupported primitive: " + primitive.getClass().getSimpleName());
    }

    private LayerStyle styleFor(GeometryClass geometryClass) {
        LayerStyle style = styles.get(geometryClass);
        return style != null ? style : LayerStyle.defaults().get(geometryClass);
    }

    @Override
    public String fileExtension() {
        return "svg";
    }

    @Override
    public String contentType() {
        return "image/svg+xml";
    }
}
