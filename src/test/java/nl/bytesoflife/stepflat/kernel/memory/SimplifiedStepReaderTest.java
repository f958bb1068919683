package nl.bytesoflife.stepflat.kernel.memory;

import nl.bytesoflife.stepflat.kernel.Face;
import nl.bytesoflife.stepflat.kernel.FaceSetReader;
import nl.bytesoflife.stepflat.kernel.SurfaceKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.math.Vector3D;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SimplifiedStepReaderTest {

    private final SimplifiedStepReader reader = new SimplifiedStepReader();

    @Test
    void oneFacePerFaceLine() {
        String step = String.join("\n",
                "ISO-10303-21;",
                "DATA;",
                "#10=ADVANCED_FACE('',(#11),#12,.T.);",
                "#20=ADVANCED_FACE('',(#21),#22,.T.);",
                "#30=FACE_BOUND('',#31,.T.);",
                "#40=ADVANCED_FACE('',(#41),#42,.T.);",
                "#50=CIRCLE('',#51,5.);",
                "#60=LINE('',#61,#62);",
                "ENDSEC;");

        FaceSetReader.FaceSet faceSet = reader.parse(step);

        assertEquals(4, faceSet.faces().size());
        assertEquals(SimplifiedStepReader.NOTE, faceSet.note());
    }

    @Test
    void atLeastThreeFaces() {
        assertEquals(3, reader.parse("ISO-10303-21;\nEND-ISO-10303-21;").faces().size());
    }

    @Test
    void facesAreOffsetSquares() {
        Face second = reader.parse("").faces().get(1);

        assertEquals(SurfaceKind.PLANE, second.surfaceKind());
        assertTrue(second.wires().isEmpty());
        assertEquals(4, second.triangulation().vertices().size());
        assertEquals(2, second.triangulation().triangles().size());
        Vector3D first = second.triangulation().vertices().get(0);
        assertEquals(-5, first.getX(), 1e-12);
        assertEquals(-5, first.getY(), 1e-12);
        Vector3D third = second.triangulation().vertices().get(2);
        assertEquals(15, third.getX(), 1e-12);
        assertEquals(15, third.getY(), 1e-12);
    }

    @Test
    void readsFiles(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("part.step");
        Files.writeString(file, "#1=ADVANCED_FACE();\n".repeat(5));

        assertEquals(5, reader.read(file).faces().size());
    }
}
