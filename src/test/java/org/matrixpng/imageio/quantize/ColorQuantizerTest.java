package org.matrixpng.imageio.quantize;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import org.matrixpng.imageio.InvalidConfigurationException;
import org.matrixpng.imageio.Mode;

/**
 *
 * @author tonyj
 */
public class ColorQuantizerTest {

    @Test
    public void testEndpoints() {
        for (int levels : new int[]{2, 3, 256, 65536}) {
            assertEquals(0, ColorQuantizer.quantize(-5.0, -5.0, 10.0, levels));
            assertEquals(levels - 1, ColorQuantizer.quantize(10.0, -5.0, 10.0, levels));
        }
    }

    @Test
    public void testRounding() {
        ColorQuantizer q = new ColorQuantizer(0, 15, 256);
        assertEquals(15.0 / 255, q.getDelta(), 1e-15);
        assertEquals(0, q.quantize(0));
        assertEquals(119, q.quantize(7));
        assertEquals(255, q.quantize(15));
        ColorQuantizer three = new ColorQuantizer(0, 1, 3);
        assertEquals(0, three.quantize(0.24));
        assertEquals(1, three.quantize(0.26));
        assertEquals(1, three.quantize(0.74));
        assertEquals(2, three.quantize(0.76));
    }

    @Test
    public void testWidestRange() {
        for (int levels : new int[]{2, 256, 65536}) {
            ColorQuantizer q = new ColorQuantizer(-Double.MAX_VALUE, Double.MAX_VALUE, levels);
            assertEquals(0, q.quantize(-Double.MAX_VALUE));
            assertEquals(levels - 1, q.quantize(Double.MAX_VALUE));
            int middle = q.quantize(0);
            assertTrue(middle == levels / 2 - 1 || middle == levels / 2);
        }
        assertEquals(255, ColorQuantizer.quantize(Double.MAX_VALUE, -Double.MAX_VALUE, Double.MAX_VALUE, 256));
        assertEquals(Double.POSITIVE_INFINITY, new ColorQuantizer(-Double.MAX_VALUE, Double.MAX_VALUE, 256).getDelta(), 0);
    }

    @Test
    public void testClipping() {
        ColorQuantizer q = new ColorQuantizer(0, 1, 256);
        assertEquals(0, q.quantize(-1e9));
        assertEquals(255, q.quantize(1e9));
        assertEquals(0, q.quantize(Double.NEGATIVE_INFINITY));
        assertEquals(255, q.quantize(Double.POSITIVE_INFINITY));
        assertEquals(0, q.quantize(-Double.MIN_VALUE));
    }

    @Test
    public void testReject() {
        ColorQuantizer q = new ColorQuantizer(0, 1, 256, OutOfRangePolicy.REJECT);
        assertEquals(255, q.quantize(1));
        try {
            q.quantize(1.5);
            fail("should not reach here");
        } catch (ValueOutOfRangeException x) {
            assertEquals(1.5, x.getValue(), 0);
        }
    }

    @Test
    public void testSingleLevel() {
        ColorQuantizer q = new ColorQuantizer(0, 1, 1);
        assertEquals(0, q.quantize(0));
        assertEquals(0, q.quantize(0.7));
        assertEquals(0, q.quantize(2));
    }

    @Test
    public void testInvalidConfiguration() {
        double[][] bounds = {{1, 1}, {2, 1}, {Double.NaN, 1}, {0, Double.POSITIVE_INFINITY}};
        for (double[] b : bounds) {
            try {
                new ColorQuantizer(b[0], b[1], 256);
                fail("should not reach here: " + b[0] + " " + b[1]);
            } catch (InvalidConfigurationException x) {
                // expected
            }
        }
        try {
            new ColorQuantizer(0, 1, 0);
            fail("should not reach here");
        } catch (InvalidConfigurationException x) {
            assertTrue(x.getMessage().contains("level"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNHasNoIndex() {
        new ColorQuantizer(0, 1, 256).quantize(Double.NaN);
    }

    @Test
    public void testIsNaN() {
        double zero = 0.0;
        double computed = zero / zero;
        assertTrue(ColorQuantizer.isNaN(computed));
        assertTrue(ColorQuantizer.isNaN(Double.POSITIVE_INFINITY - Double.POSITIVE_INFINITY));
        assertTrue(ColorQuantizer.isNaN(Double.longBitsToDouble(0x7ff8000000000001L)));
        assertFalse(ColorQuantizer.isNaN(Double.POSITIVE_INFINITY));
        assertFalse(ColorQuantizer.isNaN(0));
    }

    @Test
    public void testNaNSample() {
        assertEquals(127, ColorQuantizer.nanSample(Mode.RGB, 8));
        assertEquals(127, ColorQuantizer.nanSample(Mode.RGBA, 8));
        assertEquals(32767, ColorQuantizer.nanSample(Mode.RGB, 16));
        assertEquals(0, ColorQuantizer.nanSample(Mode.GRAY, 8));
        assertEquals(0, ColorQuantizer.nanSample(Mode.GRAY_ALPHA, 16));
    }
}
