package nl.bytesoflife.stepflat.web;

import nl.bytesoflife.stepflat.export.FacePreview;
import nl.bytesoflife.stepflat.geometry.FaceNormals;
import nl.bytesoflife.stepflat.kernel.Face;
import nl.bytesoflife.stepflat.kernel.SurfaceKind;
import nl.bytesoflife.stepflat.kernel.Triangle;
import nl.bytesoflife.stepflat.kernel.Triangulation;
import nl.bytesoflife.stepflat.model.CirclePrimitive;
import nl.bytesoflife.stepflat.model.PolylinePrimitive;
import nl.bytesoflife.stepflat.model.Primitive;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.math.Vector3D;

import java.util.List;
import java.util.Locale;

/**
 * Hand-built JSON bodies of the HTTP API.
 */
final class Json {

    private Json() {
    }

    static String error(String message) {
        return "{\"error\":" + escape(message) + "}";
    }

    static String faceInfo(int faceId, Face face) {
        StringBuilder json = new StringBuilder();
        json.append("{\"id\":").append(faceId);
        json.append(",\"type\":").append(escape(face.surfaceKind().getDisplayName()));
        json.append(",\"is_plane\":").append(face.surfaceKind() == SurfaceKind.PLANE);
        json.append(",\"mesh\":");
        mesh(json, face.triangulation());
        json.append(",\"normal\":");
        Vector3D n = FaceNormals.resolve(face);
        json.append('[').append(number(n.getX())).append(',').append(number(n.getY()))
                .append(',').append(number(n.getZ())).append(']');
        json.append('}');
        return json.toString();
    }

    private static void mesh(StringBuilder json, Triangulation mesh) {
        json.append("{\"vertices\":[");
        List<Vector3D> vertices = mesh == null ? List.of() : mesh.vertices();
        for (int i = 0; i < vertices.size(); i++) {
            if (i > 0) json.append(',');
            Vector3D v = vertices.get(i);
            json.append('[').append(number(v.getX())).append(',').append(number(v.getY()))
                    .append(',').append(number(v.getZ())).append(']');
        }
        json.append("],\"triangles\":[");
        List<Triangle> triangles = mesh == null ? List.of() : mesh.triangles();
        for (int i = 0; i < triangles.size(); i++) {
            if (i > 0) json.append(',');
            Triangle t = triangles.get(i);
            json.append('[').append(t.a()).append(',').append(t.b()).append(',').append(t.c()).append(']');
        }
        json.append("]}");
    }

    static String preview(FacePreview preview) {
        StringBuilder json = new StringBuilder();
        json.append("{\"face_id\":").append(preview.faceId());
        json.append(",\"face_type\":").append(escape(preview.faceType()));
        json.append(",\"boundary\":{\"type\":\"LWPOLYLINE\",\"points\":");
        points(json, preview.boundary());
        json.append(",\"closed\":true}");

        json.append(",\"holes\":[");
        boolean first = true;
        for (Primitive hole : preview.holes()) {
            if (!first) json.append(',');
            first = false;
            if (hole instanceof CirclePrimitive circle) {
                json.append("{\"type\":\"CIRCLE\",\"center\":[").append(number(circle.center().x))
                        .append(',').append(number(circle.center().y)).append("],\"radius\":")
                        .append(number(circle.radius())).append('}');
            } else if (hole instanceof PolylinePrimitive polyline) {
                json.append("{\"type\":\"LWPOLYLINE\",\"points\":");
                points(json, polyline.points());
                json.append(",\"closed\":true}");
            }
        }
        json.append(']');

        Envelope b = preview.bounds();
        json.append(",\"dimensions\":{\"width\":").append(number(preview.width()));
        json.append(",\"height\":").append(number(preview.height()));
        json.append(",\"bounds\":{\"x_min\":").append(number(b.getMinX()));
        json.append(",\"x_max\":").append(number(b.getMaxX()));
        json.append(",\"y_min\":").append(number(b.getMinY()));
        json.append(",\"y_max\":").append(number(b.getMaxY())).append("}}");
        json.append(",\"entity_count\":").append(preview.entityCount());
        json.append('}');
        return json.toString();
    }

    private static void points(StringBuilder json, List<Coordinate> points) {
        json.append('[');
        for (int i = 0; i < points.size(); i++) {
            if (i > 0) json.append(',');
            json.append('[').append(number(points.get(i).x)).append(',').append(number(points.get(i).y)).append(']');
        }
        json.append(']');
    }

    /**
     * JSON number; non-finite values become null.
     */
    static String number(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return "null";
        if (v == Math.rint(v) && Math.abs(v) < 1e15) return String.valueOf((long) v) + ".0";
        return String.valueOf(v);
    }

    static String escape(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 32) {
                        sb.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append("\"");
        return sb.toString();
    }
}
