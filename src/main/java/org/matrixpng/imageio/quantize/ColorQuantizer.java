package org.matrixpng.imageio.quantize;

import org.matrixpng.imageio.InvalidConfigurationException;
import org.matrixpng.imageio.Mode;

/**
 * Maps scalar values onto the indices of a palette with a fixed number of
 * levels, spaced evenly from z_min (index 0) to z_max (index levels-1).
 * Instances are immutable.
 *
 * @author tonyj
 */
public class ColorQuantizer {

    private final double zMin;
    private final double zMax;
    private final int levels;
    private final double delta;
    // 0.5 when zMax - zMin overflows, applied to both operands of the subtraction
    private final double scale;
    private final OutOfRangePolicy policy;

    public ColorQuantizer(double zMin, double zMax, int levels) {
        this(zMin, zMax, levels, OutOfRangePolicy.CLIP);
    }

    /**
     * @param zMin The value mapped to index 0
     * @param zMax The value mapped to index levels-1
     * @param levels The palette size
     * @param policy How to treat values outside [zMin, zMax]
     * @throws InvalidConfigurationException if levels &lt; 1, either bound is
     * not finite, or zMax &lt;= zMin
     */
    public ColorQuantizer(double zMin, double zMax, int levels, OutOfRangePolicy policy) {
        if (levels < 1) {
            throw new InvalidConfigurationException("Need at least one quantization level, got " + levels);
        }
        if (!Double.isFinite(zMin) || !Double.isFinite(zMax)) {
            throw new InvalidConfigurationException("z range must be finite: " + zMin + " to " + zMax);
        }
        if (!(zMax > zMin)) {
            throw new InvalidConfigurationException("z_max (" + zMax + ") must be greater than z_min (" + zMin + ")");
        }
        this.zMin = zMin;
        this.zMax = zMax;
        this.levels = levels;
        this.policy = policy;
        this.scale = Double.isInfinite(zMax - zMin) ? 0.5 : 1.0;
        double width = zMax * scale - zMin * scale;
        this.delta = levels > 1 ? width / (levels - 1) : width;
    }

    /**
     * One-off quantization with clipping.
     *
     * @see #quantize(double)
     */
    public static int quantize(double value, double zMin, double zMax, int levels) {
        return new ColorQuantizer(zMin, zMax, levels).quantize(value);
    }

    /**
     * @param value A value which must not be NaN
     * @return round((value - zMin) / delta), clamped to [0, levels-1]
     * @throws IllegalArgumentException if value is NaN
     * @throws ValueOutOfRangeException if the value is outside the z range and
     * the policy is {@link OutOfRangePolicy#REJECT}
     */
    public int quantize(double value) {
        if (isNaN(value)) {
            throw new IllegalArgumentException("NaN has no palette index");
        }
        if (value < zMin || value > zMax) {
            if (policy == OutOfRangePolicy.REJECT) {
                throw new ValueOutOfRangeException(value, zMin, zMax);
            }
            return value < zMin ? 0 : levels - 1;
        }
        long index = Math.round((value * scale - zMin * scale) / delta);
        return (int) Math.max(0, Math.min(levels - 1, index));
    }

    /**
     * A value is NaN if and only if it is not equal to itself.
     */
    public static boolean isNaN(double value) {
        return value != value;
    }

    /**
     * The sample written to every color channel of a NaN cell: mid-gray for
     * color modes, zero for gray modes.
     *
     * @param mode The image mode
     * @param bitDepth The bits per channel
     * @return The sentinel sample value
     */
    public static int nanSample(Mode mode, int bitDepth) {
        return mode.isColor() ? (1 << (bitDepth - 1)) - 1 : 0;
    }

    public double getZMin() {
        return zMin;
    }

    public double getZMax() {
        return zMax;
    }

    public int getLevels() {
        return levels;
    }

    /**
     * @return The z step between adjacent levels, infinite if the z range is
     * wider than the largest double
     */
    public double getDelta() {
        return delta / scale;
    }

    public OutOfRangePolicy getPolicy() {
        return policy;
    }

    @Override
    public String toString() {
        return "ColorQuantizer{" + "zMin=" + zMin + ", zMax=" + zMax + ", levels=" + levels + ", delta=" + delta + ", policy=" + policy + '}';
    }
}
