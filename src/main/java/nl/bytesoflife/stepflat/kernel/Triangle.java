package nl.bytesoflife.stepflat.kernel;

/**
 * Zero-based vertex indices of one mesh triangle.
 */
public record Triangle(int a, int b, int c) {

    public int[] indices() {
        return new int[]{a, b, c};
    }
}
