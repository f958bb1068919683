package nl.bytesoflife.stepflat.kernel.memory;

import nl.bytesoflife.stepflat.kernel.Edge;
import nl.bytesoflife.stepflat.kernel.Wire;

import java.util.List;

public class MemoryWire implements Wire {

    private final List<AbstractEdge> edges;

    public MemoryWire(List<? extends AbstractEdge> edges) {
        this.edges = List.copyOf(edges);
    }

    public static MemoryWire of(AbstractEdge... edges) {
        return new MemoryWire(List.of(edges));
    }

    /**
     * Closed polygon in a plane parallel to XY through the given corner points.
     */
    public static MemoryWire polygon(double z, double... xy) {
        if (xy.length < 6 || xy.length % 2 != 0) {
            throw new IllegalArgumentException("Polygon needs at least three x,y pairs");
        }
        int n = xy.length / 2;
        LineEdge[] edges = new LineEdge[n];
        for (int i = 0; i < n; i++) {
            int j = (i + 1) % n;
            edges[i] = new LineEdge(xy[2 * i], xy[2 * i + 1], z, xy[2 * j], xy[2 * j + 1], z);
        }
        return of(edges);
    }

    @Override
    public List<Edge> edges() {
        return List.copyOf(edges);
    }

    @Override
    public double length() {
        double length = 0;
        for (AbstractEdge edge : edges) {
            length += edge.arcLength();
        }
        return length;
    }
}
