package org.matrixpng.imageio;

import java.util.Arrays;

/**
 * A height x width x channels grid of integer samples, each in
 * [0, 2^bitDepth - 1]. Row 0 is the top of the image.
 *
 * @author tonyj
 */
public class PixelBuffer {

    private final int width;
    private final int height;
    private final Mode mode;
    private final int bitDepth;
    private final int[] samples;

    public PixelBuffer(int width, int height, Mode mode, int bitDepth) {
        this.width = width;
        this.height = height;
        this.mode = mode;
        this.bitDepth = bitDepth;
        this.samples = new int[sampleCount(width, height, mode)];
    }

    /**
     * Copy existing samples, stored row by row with the channels of each
     * pixel adjacent.
     */
    public PixelBuffer(int width, int height, Mode mode, int bitDepth, int[] samples) {
        int count = sampleCount(width, height, mode);
        if (samples.length != count) {
            throw new IllegalArgumentException("Expected " + count + " samples, got " + samples.length);
        }
        this.width = width;
        this.height = height;
        this.mode = mode;
        this.bitDepth = bitDepth;
        this.samples = samples.clone();
    }

    private static int sampleCount(int width, int height, Mode mode) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid size " + width + "x" + height);
        }
        try {
            return Math.multiplyExact(Math.multiplyExact(width, height), mode.getChannels());
        } catch (ArithmeticException x) {
            throw new InvalidConfigurationException("Image of " + width + "x" + height + " " + mode + " pixels is too large", x);
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Mode getMode() {
        return mode;
    }

    public int getBitDepth() {
        return bitDepth;
    }

    public int getMaxValue() {
        return (1 << bitDepth) - 1;
    }

    public int getSample(int row, int column, int channel) {
        return samples[offset(row, column) + channel];
    }

    public void setSample(int row, int column, int channel, int value) {
        samples[offset(row, column) + channel] = value;
    }

    /**
     * Copy the first <code>count</code> entries of <code>color</code> into
     * the leading channels of one pixel.
     */
    public void setColor(int row, int column, int[] color, int count) {
        System.arraycopy(color, 0, samples, offset(row, column), count);
    }

    public void fill(int value) {
        Arrays.fill(samples, value);
    }

    /**
     * @return A new buffer with rows and columns swapped
     */
    public PixelBuffer transpose() {
        int channels = mode.getChannels();
        PixelBuffer result = new PixelBuffer(height, width, mode, bitDepth);
        for (int row = 0; row < height; row++) {
            for (int column = 0; column < width; column++) {
                System.arraycopy(samples, offset(row, column), result.samples, result.offset(column, row), channels);
            }
        }
        return result;
    }

    /**
     * @return A new buffer with the row order reversed
     */
    public PixelBuffer flipVertical() {
        int rowLength = width * mode.getChannels();
        PixelBuffer result = new PixelBuffer(width, height, mode, bitDepth);
        for (int row = 0; row < height; row++) {
            System.arraycopy(samples, row * rowLength, result.samples, (height - 1 - row) * rowLength, rowLength);
        }
        return result;
    }

    /**
     * @return A copy of the samples, row by row, channels interleaved
     */
    public int[] getSamples() {
        return samples.clone();
    }

    private int offset(int row, int column) {
        if (row < 0 || row >= height || column < 0 || column >= width) {
            throw new IndexOutOfBoundsException("(" + row + "," + column + ") outside " + height + "x" + width);
        }
        return (row * width + column) * mode.getChannels();
    }

    @Override
    public String toString() {
        return "PixelBuffer{" + "width=" + width + ", height=" + height + ", mode=" + mode + ", bitDepth=" + bitDepth + '}';
    }
}
