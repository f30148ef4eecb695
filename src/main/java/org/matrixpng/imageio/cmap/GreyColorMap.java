package org.matrixpng.imageio.cmap;

/**
 * Single channel linear ramp, used for the gray modes.
 *
 * @author tonyj
 */
public class GreyColorMap extends ColorMap {

    public static final String NAME = "grey";

    public GreyColorMap(int bitDepth) {
        super(NAME, bitDepth, 1);
        for (int i = 0; i < getSize(); i++) {
            setSample(i, 0, i);
        }
    }
}
