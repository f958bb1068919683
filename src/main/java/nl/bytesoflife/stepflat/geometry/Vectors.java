package nl.bytesoflife.stepflat.geometry;

import org.locationtech.jts.math.Vector3D;

/**
 * Small vector helpers missing from {@link Vector3D}.
 */
public final class Vectors {

    public static final Vector3D X_AXIS = new Vector3D(1, 0, 0);
    public static final Vector3D Y_AXIS = new Vector3D(0, 1, 0);
    public static final Vector3D Z_AXIS = new Vector3D(0, 0, 1);

    private Vectors() {
    }

    public static Vector3D scale(Vector3D v, double s) {
        return new Vector3D(v.getX() * s, v.getY() * s, v.getZ() * s);
    }

    public static Vector3D plus(Vector3D a, Vector3D b) {
        return new Vector3D(a.getX() + b.getX(), a.getY() + b.getY(), a.getZ() + b.getZ());
    }

    public static Vector3D minus(Vector3D a, Vector3D b) {
        return new Vector3D(a.getX() - b.getX(), a.getY() - b.getY(), a.getZ() - b.getZ());
    }

    public static Vector3D cross(Vector3D a, Vector3D b) {
        return new Vector3D(
                a.getY() * b.getZ() - a.getZ() * b.getY(),
                a.getZ() * b.getX() - a.getX() * b.getZ(),
                a.getX() * b.getY() - a.getY() * b.getX());
    }

    public static double distance(Vector3D a, Vector3D b) {
        return minus(a, b).length();
    }
}
