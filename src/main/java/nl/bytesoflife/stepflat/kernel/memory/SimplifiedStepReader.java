package nl.bytesoflife.stepflat.kernel.memory;

import nl.bytesoflife.stepflat.kernel.Face;
import nl.bytesoflife.stepflat.kernel.FaceSetReader;
import nl.bytesoflife.stepflat.kernel.SurfaceKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Stand-in for a full B-rep kernel. Counts face entities in the STEP text and returns one planar
 * 20 by 20 square mesh per face (at least three), each offset diagonally by 5 units from the
 * previous one. The faces carry no exact wires, so exports take the mesh path.
 */
public class SimplifiedStepReader implements FaceSetReader {

    private static final Logger log = LoggerFactory.getLogger(SimplifiedStepReader.class);

    public static final String NOTE = "Using simplified STEP parsing (no B-rep kernel available)";

    private static final int MIN_FACES = 3;
    private static final double HALF_SIZE = 10;
    private static final double OFFSET_STEP = 5;

    @Override
    public FaceSet read(Path file) throws IOException {
        return parse(new String(Files.readAllBytes(file), StandardCharsets.ISO_8859_1));
    }

    public FaceSet parse(String content) {
        int faces = 0;
        int circles = 0;
        int lines = 0;

        for (String line : content.split("\n")) {
            String upper = line.trim().toUpperCase(Locale.ROOT);
            // a line is counted once, FACE taking precedence
            if (upper.contains("FACE")) {
                faces++;
            } else if (upper.contains("CIRCLE")) {
                circles++;
            } else if (upper.contains("LINE")) {
                lines++;
            }
        }
        log.info("Scanned STEP text: {} face, {} circle and {} line entities", faces, circles, lines);

        int count = Math.max(faces, MIN_FACES);
        List<Face> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(squareFace(i * OFFSET_STEP));
        }
        return new FaceSet(result, NOTE);
    }

    static Face squareFace(double offset) {
        double lo = -HALF_SIZE + offset;
        double hi = HALF_SIZE + offset;
        return MemoryFace.builder()
                .surfaceKind(SurfaceKind.PLANE)
                .mesh(new double[]{
                        lo, lo, 0,
                        hi, lo, 0,
                        hi, hi, 0,
                        lo, hi, 0
                }, new int[]{0, 1, 2, 0, 2, 3})
                .build();
    }
}
