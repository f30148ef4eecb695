package org.matrixpng.imageio;

/**
 * What can be recovered from an image written by {@link MatrixImageCodec}:
 * the scale metadata and the raw decoded pixels.
 *
 * @author tonyj
 */
public class MatrixImage {

    private final ScaleConfig scale;
    private final PixelBuffer pixels;

    MatrixImage(ScaleConfig scale, PixelBuffer pixels) {
        this.scale = scale;
        this.pixels = pixels;
    }

    public ScaleConfig getScale() {
        return scale;
    }

    /**
     * @return The decoded samples, top row first, with no conversion back to
     * matrix values
     */
    public PixelBuffer getPixels() {
        return pixels;
    }

    @Override
    public String toString() {
        return "MatrixImage{" + "scale=" + scale + ", pixels=" + pixels + '}';
    }
}
