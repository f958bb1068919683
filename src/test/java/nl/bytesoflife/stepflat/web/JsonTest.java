package nl.bytesoflife.stepflat.web;

import nl.bytesoflife.stepflat.export.FacePreview;
import nl.bytesoflife.stepflat.kernel.SurfaceKind;
import nl.bytesoflife.stepflat.kernel.memory.MemoryFace;
import nl.bytesoflife.stepflat.model.CirclePrimitive;
import nl.bytesoflife.stepflat.model.GeometryClass;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonTest {

    @Test
    void escapesStrings() {
        assertEquals("\"a\\\"b\\\\c\\n\"", Json.escape("a\"b\\c\n"));
        assertEquals("\"\\u0001\"", Json.escape("\u0001"));
        assertEquals("null", Json.escape(null));
        assertEquals("{\"error\":\"boom\"}", Json.error("boom"));
    }

    @Test
    void numbers() {
        assertEquals("10.0", Json.number(10));
        assertEquals("-0.125", Json.number(-0.125));
        assertEquals("null", Json.number(Double.NaN));
    }

    @Test
    void previewPayload() {
        FacePreview preview = new FacePreview(1, "Plane",
                List.of(new Coordinate(0, 0), new Coordinate(4, 0), new Coordinate(4, 3), new Coordinate(0, 0)),
                List.of(new CirclePrimitive(new Coordinate(2, 1), 0.5, GeometryClass.HOLE)),
                4, 3, new Envelope(0, 4, 0, 3), false);

        String json = Json.preview(preview);

        assertTrue(json.startsWith("{\"face_id\":1,\"face_type\":\"Plane\""));
        assertTrue(json.contains("\"boundary\":{\"type\":\"LWPOLYLINE\",\"points\":[[0.0,0.0],[4.0,0.0],[4.0,3.0],[0.0,0.0]],\"closed\":true}"));
        assertTrue(json.contains("\"holes\":[{\"type\":\"CIRCLE\",\"center\":[2.0,1.0],\"radius\":0.5}]"));
        assertTrue(json.contains("\"dimensions\":{\"width\":4.0,\"height\":3.0,\"bounds\":{\"x_min\":0.0,\"x_max\":4.0,\"y_min\":0.0,\"y_max\":3.0}}"));
        assertTrue(json.endsWith("\"entity_count\":2}"));
    }

    @Test
    void faceInfoPayload() {
        String json = Json.faceInfo(0, MemoryFace.builder()
                .surfaceKind(SurfaceKind.PLANE)
                .mesh(new double[]{0, 0, 0, 1, 0, 0, 0, 1, 0}, new int[]{0, 1, 2})
                .build());

        assertEquals("{\"id\":0,\"type\":\"Plane\",\"is_plane\":true,"
                + "\"mesh\":{\"vertices\":[[0.0,0.0,0.0],[1.0,0.0,0.0],[0.0,1.0,0.0]],\"triangles\":[[0,1,2]]},"
                + "\"normal\":[0.0,0.0,1.0]}", json);
    }
}
