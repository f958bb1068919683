package nl.bytesoflife.stepflat.export;

import nl.bytesoflife.stepflat.kernel.CurveEvaluationException;
import nl.bytesoflife.stepflat.kernel.Wire;
import nl.bytesoflife.stepflat.model.GeometryClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the outer loop of a face: the longest wire is the boundary, every other wire a hole.
 * When several wires share the greatest length the last of them wins.
 */
public class WireClassifier {

    private static final Logger log = LoggerFactory.getLogger(WireClassifier.class);

    public List<ClassifiedWire> classify(List<Wire> wires) {
        double[] lengths = new double[wires.size()];
        int boundary = -1;
        for (int i = 0; i < wires.size(); i++) {
            lengths[i] = lengthOf(wires.get(i), i);
            if (boundary < 0 || lengths[i] >= lengths[boundary]) {
                boundary = i;
            }
        }

        List<ClassifiedWire> classified = new ArrayList<>(wires.size());
        for (int i = 0; i < wires.size(); i++) {
            GeometryClass role = i == boundary ? GeometryClass.BOUNDARY : GeometryClass.HOLE;
            classified.add(new ClassifiedWire(i, wires.get(i), lengths[i], role));
        }
        if (boundary >= 0) {
            log.debug("Wire {} of {} identified as boundary (length {})", boundary + 1, wires.size(), lengths[boundary]);
        }
        return classified;
    }

    private static double lengthOf(Wire wire, int index) {
        try {
            return wire.length();
        } catch (CurveEvaluationException e) {
            log.warn("Length of wire {} unavailable, treating as 0: {}", index + 1, e.getMessage());
            return 0;
        }
    }

    public record ClassifiedWire(int index, Wire wire, double length, GeometryClass role) {

        public boolean isBoundary() {
            return role == GeometryClass.BOUNDARY;
        }
    }
}
