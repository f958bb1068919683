package nl.bytesoflife.stepflat.kernel;

import java.util.List;

/**
 * A closed loop of edges on a face, in traversal order.
 */
public interface Wire {

    List<Edge> edges();

    /**
     * Sum of the arc lengths of the edges.
     */
    double length();
}
