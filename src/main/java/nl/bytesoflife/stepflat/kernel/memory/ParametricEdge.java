package nl.bytesoflife.stepflat.kernel.memory;

import nl.bytesoflife.stepflat.kernel.CurveEvaluationException;
import nl.bytesoflife.stepflat.kernel.CurveKind;
import org.locationtech.jts.math.Vector3D;

import java.util.function.DoubleFunction;

/**
 * Free-form curve given by an evaluation function, e.g. a spline supplied by the caller.
 */
public class ParametricEdge extends AbstractEdge {

    private final DoubleFunction<Vector3D> curve;

    public ParametricEdge(DoubleFunction<Vector3D> curve, double first, double last) {
        super(first, last);
        this.curve = curve;
    }

    @Override
    public CurveKind curveKind() {
        return CurveKind.OTHER;
    }

    @Override
    public Vector3D valueAt(double parameter) {
        Vector3D value;
        try {
            value = curve.apply(parameter);
        } catch (RuntimeException e) {
            throw new CurveEvaluationException("Curve evaluation failed at t=" + parameter, e);
        }
        if (value == null) {
            throw new CurveEvaluationException("Curve has no value at t=" + parameter);
        }
        return value;
    }
}
