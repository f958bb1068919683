package nl.bytesoflife.stepflat.export;

import nl.bytesoflife.stepflat.kernel.SurfaceKind;
import nl.bytesoflife.stepflat.model.Primitive;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * Drawing primitives of one face, ready for a drawing writer.
 *
 * @param faceId     zero based index of the face within its file
 * @param surfaceKind kind of the source surface
 * @param stage      stage that produced the primitives
 * @param primitives boundary primitives first, then holes; within a class other primitives keep wire
 *                   order and arcs follow them; never empty
 * @param wireCount  number of wires the primitives were taken from
 * @param notes      reasons earlier stages were abandoned
 */
public record FaceExport(int faceId, SurfaceKind surfaceKind, ExportStage stage,
                         List<Primitive> primitives, int wireCount, List<String> notes) {

    public FaceExport {
        primitives = List.copyOf(primitives);
        notes = List.copyOf(notes);
    }

    public int entityCount() {
        return primitives.size();
    }

    public Envelope envelope() {
        Envelope env = new Envelope();
        for (Primitive p : primitives) {
            env.expandToInclude(p.envelope());
        }
        return env;
    }
}
