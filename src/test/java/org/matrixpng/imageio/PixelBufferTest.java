package org.matrixpng.imageio;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class PixelBufferTest {

    @Test
    public void testTransposeAndFlip() {
        // 3 wide, 2 high, two channels
        int[] samples = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11};
        PixelBuffer pixels = new PixelBuffer(3, 2, Mode.GRAY_ALPHA, 8, samples);
        assertEquals(8, pixels.getSample(1, 1, 0));
        assertEquals(9, pixels.getSample(1, 1, 1));

        PixelBuffer transposed = pixels.transpose();
        assertEquals(2, transposed.getWidth());
        assertEquals(3, transposed.getHeight());
        assertEquals(4, transposed.getSample(2, 0, 0));
        assertEquals(11, transposed.getSample(2, 1, 1));

        PixelBuffer flipped = pixels.flipVertical();
        assertArrayEquals(new int[]{6, 7, 8, 9, 10, 11, 0, 1, 2, 3, 4, 5}, flipped.getSamples());
    }

    @Test
    public void testSetColorLeavesAlpha() {
        PixelBuffer pixels = new PixelBuffer(1, 1, Mode.RGBA, 16);
        pixels.fill(pixels.getMaxValue());
        pixels.setColor(0, 0, new int[]{1, 2, 3}, 3);
        assertArrayEquals(new int[]{1, 2, 3, 65535}, pixels.getSamples());
    }

    @Test
    public void testSamplesAreCopied() {
        int[] samples = {1, 2, 3, 4};
        PixelBuffer pixels = new PixelBuffer(2, 2, Mode.GRAY, 8, samples);
        samples[0] = 99;
        assertEquals(1, pixels.getSample(0, 0, 0));
        pixels.getSamples()[1] = 99;
        assertEquals(2, pixels.getSample(0, 1, 0));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testTooLarge() {
        new PixelBuffer(65536, 65536, Mode.RGBA, 8);
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testTooLargeMatrix() {
        new Matrix(65536, 65536, new double[1]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongSampleCount() {
        new PixelBuffer(2, 2, Mode.RGB, 8, new int[4]);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testOutOfBounds() {
        new PixelBuffer(2, 2, Mode.GRAY, 8).getSample(2, 0, 0);
    }

    @Test
    public void testMatrix() {
        Matrix matrix = new Matrix(2, 2, new double[]{Double.NaN, -3, 7, Double.NaN});
        assertEquals(-3.0, matrix.min(), 0);
        assertEquals(7.0, matrix.max(), 0);
        assertEquals(7.0, matrix.get(1, 0), 0);
        assertEquals(matrix, new Matrix(new double[][]{{Double.NaN, -3}, {7, Double.NaN}}));
        assertTrue(Double.isNaN(new Matrix(new double[][]{{Double.NaN}}).min()));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testRaggedMatrix() {
        new Matrix(new double[][]{{1, 2}, {3}});
    }

    @Test
    public void testModes() {
        assertEquals(Mode.GRAY_ALPHA, Mode.fromName("LA"));
        assertEquals(Mode.RGBA, Mode.forChannels(4));
        assertEquals(3, Mode.RGBA.getColorChannels());
        assertEquals(1, Mode.GRAY_ALPHA.getColorChannels());
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testUnknownMode() {
        Mode.fromName("CMYK");
    }
}
