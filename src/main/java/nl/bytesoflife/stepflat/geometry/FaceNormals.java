package nl.bytesoflife.stepflat.geometry;

import nl.bytesoflife.stepflat.kernel.Face;
import nl.bytesoflife.stepflat.kernel.Triangle;
import nl.bytesoflife.stepflat.kernel.Triangulation;
import org.locationtech.jts.math.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the normal used to flatten a face: the kernel's surface normal, else the normal of the
 * first mesh triangle, else +Z.
 */
public final class FaceNormals {

    private static final Logger log = LoggerFactory.getLogger(FaceNormals.class);

    private FaceNormals() {
    }

    public static Vector3D resolve(Face face) {
        Vector3D normal = null;
        try {
            normal = face.normal();
        } catch (RuntimeException e) {
            log.warn("Kernel normal unavailable: {}", e.getMessage());
        }
        if (normal != null && normal.length() > 0) {
            return normal.normalize();
        }
        Vector3D meshNormal = fromMesh(face.triangulation());
        return meshNormal != null ? meshNormal : Vectors.Z_AXIS;
    }

    /**
     * Normal of the first triangle, or null when the mesh has no usable triangle.
     */
    public static Vector3D fromMesh(Triangulation mesh) {
        if (mesh == null || mesh.vertices().size() < 3 || mesh.triangles().isEmpty()) return null;

        Triangle t = mesh.triangles().get(0);
        int n = mesh.vertices().size();
        if (!inRange(t.a(), n) || !inRange(t.b(), n) || !inRange(t.c(), n)) return null;

        Vector3D v1 = mesh.vertices().get(t.a());
        Vector3D e1 = Vectors.minus(mesh.vertices().get(t.b()), v1);
        Vector3D e2 = Vectors.minus(mesh.vertices().get(t.c()), v1);
        Vector3D normal = Vectors.cross(e1, e2);
        return normal.length() > 0 ? normal.normalize() : null;
    }

    private static boolean inRange(int index, int size) {
        return index >= 0 && index < size;
    }
}
