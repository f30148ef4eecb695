package org.matrixpng.imageio.quantize;

/**
 * What to do with a value outside [z_min, z_max].
 *
 * @author tonyj
 */
public enum OutOfRangePolicy {
    /**
     * Map to the nearest boundary index.
     */
    CLIP,
    /**
     * Throw {@link ValueOutOfRangeException}.
     */
    REJECT
}
