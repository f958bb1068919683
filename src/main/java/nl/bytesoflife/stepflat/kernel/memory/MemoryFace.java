package nl.bytesoflife.stepflat.kernel.memory;

import nl.bytesoflife.stepflat.kernel.Face;
import nl.bytesoflife.stepflat.kernel.SurfaceKind;
import nl.bytesoflife.stepflat.kernel.Triangle;
import nl.bytesoflife.stepflat.kernel.Triangulation;
import nl.bytesoflife.stepflat.kernel.Wire;
import org.locationtech.jts.math.Vector3D;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable face assembled in memory, either from exact wires, from a mesh, or both.
 */
public class MemoryFace implements Face {

    private final SurfaceKind surfaceKind;
    private final Vector3D normal;
    private final List<Wire> wires;
    private final Triangulation triangulation;

    private MemoryFace(Builder builder) {
        this.surfaceKind = builder.surfaceKind;
        this.normal = builder.normal;
        this.wires = List.copyOf(builder.wires);
        this.triangulation = builder.triangulation;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public SurfaceKind surfaceKind() {
        return surfaceKind;
    }

    @Override
    public Vector3D normal() {
        return normal;
    }

    @Override
    public List<Wire> wires() {
        return wires;
    }

    @Override
    public Triangulation triangulation() {
        return triangulation;
    }

    public static class Builder {
        private SurfaceKind surfaceKind = SurfaceKind.PLANE;
        private Vector3D normal;
        private final List<Wire> wires = new ArrayList<>();
        private Triangulation triangulation = Triangulation.empty();

        public Builder surfaceKind(SurfaceKind surfaceKind) {
            this.surfaceKind = surfaceKind;
            return this;
        }

        public Builder normal(double x, double y, double z) {
            this.normal = new Vector3D(x, y, z);
            return this;
        }

        public Builder normal(Vector3D normal) {
            this.normal = normal;
            return this;
        }

        public Builder wire(Wire wire) {
            wires.add(wire);
            return this;
        }

        public Builder triangulation(Triangulation triangulation) {
            this.triangulation = triangulation;
            return this;
        }

        /**
         * Mesh from flat vertex coordinates (x, y, z triples) and flat triangle indices.
         */
        public Builder mesh(double[] xyz, int[] triangleIndices) {
            List<Vector3D> vertices = new ArrayList<>();
            for (int i = 0; i + 2 < xyz.length; i += 3) {
                vertices.add(new Vector3D(xyz[i], xyz[i + 1], xyz[i + 2]));
            }
            List<Triangle> triangles = new ArrayList<>();
            for (int i = 0; i + 2 < triangleIndices.length; i += 3) {
                triangles.add(new Triangle(triangleIndices[i], triangleIndices[i + 1], triangleIndices[i + 2]));
            }
            this.triangulation = new Triangulation(vertices, triangles);
            return this;
        }

        public MemoryFace build() {
            return new MemoryFace(this);
        }
    }
}
