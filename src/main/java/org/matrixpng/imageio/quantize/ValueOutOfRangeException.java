package org.matrixpng.imageio.quantize;

/**
 * Thrown for a value outside the z range when quantizing with
 * {@link OutOfRangePolicy#REJECT}.
 *
 * @author tonyj
 */
public class ValueOutOfRangeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final double value;

    public ValueOutOfRangeException(double value, double zMin, double zMax) {
        super("Value " + value + " outside [" + zMin + ", " + zMax + "]");
        this.value = value;
    }

    public double getValue() {
        return value;
    }
}
