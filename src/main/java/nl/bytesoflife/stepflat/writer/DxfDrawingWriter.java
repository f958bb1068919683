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

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a face as an ASCII DXF drawing in millimetres. Every geometry class gets its own layer;
 * the header, a layer table and the entities section are emitted, which CAD and CAM tools accept
 * without the object sections of a full drawing database.
 */
public class DxfDrawingWriter implements DrawingWriter {

    private final Map<GeometryClass, LayerStyle> styles;

    public DxfDrawingWriter() {
        this(LayerStyle.defaults());
    }

    public DxfDrawingWriter(Map<GeometryClass, LayerStyle> styles) {
        this.styles = styles;
    }

    @Override
    public byte[] render(FaceExport export) {
        return toDxf(export).getBytes(StandardCharsets.US_ASCII);
    }

    public String toDxf(FaceExport export) {
        StringBuilder dxf = new StringBuilder();

        section(dxf, "HEADER");
        group(dxf, 9, "$ACADVER");
        group(dxf, 1, "AC1015");
        group(dxf, 9, "$INSUNITS");
        group(dxf, 70, "4");
        endSection(dxf);

        section(dxf, "TABLES");
        group(dxf, 0, "TABLE");
        group(dxf, 2, "LAYER");
        group(dxf, 70, String.valueOf(GeometryClass.values().length + 1));
        layer(dxf, "0", 7);
        for (GeometryClass geometryClass : GeometryClass.values()) {
            LayerStyle style = styleFor(geometryClass);
            layer(dxf, style.layerName(), style.dxfColor());
        }
        group(dxf, 0, "ENDTAB");
        endSection(dxf);

        section(dxf, "ENTITIES");
        for (Primitive primitive : export.primitives()) {
            entity(dxf, primitive, styleFor(primitive.geometryClass()).layerName());
        }
        endSection(dxf);

        group(dxf, 0, "EOF");
        return dxf.toString();
    }

    private void entity(StringBuilder dxf, Primitive primitive, String layer) {
        if (primitive instanceof LinePrimitive line) {
            group(dxf, 0, "LINE");
            group(dxf, 8, layer);
            point(dxf, 10, line.p1());
            point(dxf, 11, line.p2());
        } else if (primitive instanceof CirclePrimitive circle) {
            group(dxf, 0, "CIRCLE");
            group(dxf, 8, layer);
            point(dxf, 10, circle.center());
            group(dxf, 40, num(circle.radius()));
        } else if (primitive instanceof ArcPrimitive arc) {
            // DXF arcs always run counter-clockwise from start angle to end angle
            group(dxf, 0, "ARC");
            group(dxf, 8, layer);
            point(dxf, 10, arc.center());
            group(dxf, 40, num(arc.radius()));
            group(dxf, 50, num(arc.startAngle()));
            group(dxf, 51, num(arc.endAngle()));
        } else if (primitive instanceof EllipsePrimitive ellipse) {
            group(dxf, 0, "ELLIPSE");
            group(dxf, 8, layer);
            point(dxf, 10, ellipse.center());
            point(dxf, 11, ellipse.majorAxis());
            group(dxf, 40, num(ellipse.ratio()));
            group(dxf, 41, num(0));
            group(dxf, 42, num(2 * Math.PI));
        } else if (primitive instanceof PolylinePrimitive polyline) {
            group(dxf, 0, "LWPOLYLINE");
            group(dxf, 8, layer);
            group(dxf, 90, String.valueOf(polyline.points().size()));
            group(dxf, 70, polyline.closed() ? "1" : "0");
            for (Coordinate p : polyline.points()) {
                group(dxf, 10, num(p.x));
                group(dxf, 20, num(p.y));
            }
        } else {
            throw new IllegalArgumentException("Unsupported primitive: " + primitive.getClass().getSimpleName());
        }
    }

    private static void layer(StringBuilder dxf, String name, int color) {
        group(dxf, 0, "LAYER");
        group(dxf, 2, name);
        group(dxf, 70, "0");
        group(dxf, 62, String.valueOf(color));
        group(dxf, 6, "CONTINUOUS");
    }

    private static void point(StringBuilder dxf, int code, Coordinate p) {
        group(dxf, code, num(p.x));
        group(dxf, code + 10, num(p.y));
        group(dxf, code + 20, num(0));
    }

    private static void section(StringBuilder dxf, String name) {
        group(dxf, 0, "SECTION");
        group(dxf, 2, name);
    }

    private static void endSection(StringBuilder dxf) {
        group(dxf, 0, "ENDSEC");
    }

    private static void group(StringBuilder dxf, int code, String value) {
        dxf.append(String.format(Locale.US, "%3d", code)).append('\n').append(value).append('\n');
    }

    private static String num(double v) {
        return String.format(Locale.US, "%.6f", v);
    }

    private LayerStyle styleFor(GeometryClass geometryClass) {
        LayerStyle style = styles.get(geometryClass);
        return style != null ? style : LayerStyle.defaults().get(geometryClass);
    }

    @Override
    public String fileExtension() {
        return "dxf";
    }

    @Override
    public String contentType() {
        return "application/octet-stream";
    }
}
