package nl.bytesoflife.stepflat.kernel;

import org.locationtech.jts.math.Vector3D;

import java.util.List;

/**
 * A bounded surface as exposed by the B-rep kernel.
 */
public interface Face {

    SurfaceKind surfaceKind();

    /**
     * Unit normal of the surface, or {@code null} when the kernel cannot compute one.
     */
    Vector3D normal();

    /**
     * Boundary loops of the face. Empty when exact curve data is not available.
     */
    List<Wire> wires();

    Triangulation triangulation();
}
