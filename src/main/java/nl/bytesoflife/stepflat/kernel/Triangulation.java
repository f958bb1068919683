package nl.bytesoflife.stepflat.kernel;

import org.locationtech.jts.math.Vector3D;

import java.util.List;

/**
 * Triangulated approximation of a face surface.
 */
public record Triangulation(List<Vector3D> vertices, List<Triangle> triangles) {

    public Triangulation {
        vertices = List.copyOf(vertices);
        triangles = List.copyOf(triangles);
    }

    public static Triangulation empty() {
        return new Triangulation(List.of(), List.of());
    }

    public boolean isEmpty() {
        return vertices.isEmpty();
    }
}
