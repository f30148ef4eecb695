package org.matrixpng.imageio.png;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.WritableRaster;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import javax.imageio.ImageIO;
import org.junit.Test;
import org.matrixpng.imageio.Mode;
import org.matrixpng.imageio.PixelBuffer;

/**
 *
 * @author tonyj
 */
public class PngContainerCodecTest {

    private final PngContainerCodec codec = new PngContainerCodec();

    @Test
    public void testPixelRoundTrip() throws IOException {
        for (Mode mode : Mode.values()) {
            for (int bitDepth : new int[]{8, 16}) {
                PixelBuffer pixels = pattern(3, 2, mode, bitDepth);
                PixelBuffer decoded = codec.decode(codec.encode(pixels));
                assertEquals(mode, decoded.getMode());
                assertEquals(bitDepth, decoded.getBitDepth());
                assertEquals(3, decoded.getWidth());
                assertEquals(2, decoded.getHeight());
                assertArrayEquals(mode + " " + bitDepth, pixels.getSamples(), decoded.getSamples());
            }
        }
    }

    @Test
    public void testPaletteImage() throws IOException {
        PixelBuffer pixels = new PngContainerCodec().decode(paletteImage());
        assertEquals(Mode.RGB, pixels.getMode());
        assertEquals(8, pixels.getBitDepth());
        assertEquals(4, pixels.getWidth());
        assertEquals(4, pixels.getHeight());
        assertArrayEquals(new int[]{0, 0, 0}, new int[]{pixels.getSample(0, 0, 0), pixels.getSample(0, 0, 1), pixels.getSample(0, 0, 2)});
        assertArrayEquals(new int[]{255, 0, 0}, new int[]{pixels.getSample(0, 1, 0), pixels.getSample(0, 1, 1), pixels.getSample(0, 1, 2)});
        assertArrayEquals(new int[]{0, 0, 255}, new int[]{pixels.getSample(3, 3, 0), pixels.getSample(3, 3, 1), pixels.getSample(3, 3, 2)});
    }

    /**
     * A 4x4 image with a four entry palette, pixel (row, column) holding
     * entry (row + column) % 4.
     */
    public static byte[] paletteImage() throws IOException {
        byte[] r = {0, (byte) 255, 0, 0};
        byte[] g = {0, 0, (byte) 255, 0};
        byte[] b = {0, 0, 0, (byte) 255};
        IndexColorModel cm = new IndexColorModel(8, 4, r, g, b);
        BufferedImage image = new BufferedImage(4, 4, BufferedImage.TYPE_BYTE_INDEXED, cm);
        WritableRaster raster = image.getRaster();
        for (int row = 0; row < 4; row++) {
            for (int column = 0; column < 4; column++) {
                raster.setSample(column, row, 0, (row + column) % 4);
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    @Test
    public void testChunks() throws IOException {
        byte[] png = codec.encode(pattern(4, 4, Mode.RGB, 8));
        List<PngChunk> chunks = codec.readChunks(png);
        assertEquals("IHDR", chunks.get(0).getType());
        assertEquals(PngChunk.IEND, chunks.get(chunks.size() - 1).getType());
        assertArrayEquals(png, codec.writeChunks(chunks));
    }

    @Test
    public void testInsertBeforeEnd() throws IOException {
        List<PngChunk> chunks = codec.readChunks(codec.encode(pattern(2, 2, Mode.GRAY, 8)));
        int size = chunks.size();
        PngChunk first = new PngChunk("tEXt", "a\0one".getBytes(StandardCharsets.ISO_8859_1));
        PngChunk second = new PngChunk("tEXt", "b\0two".getBytes(StandardCharsets.ISO_8859_1));
        codec.insertBeforeEnd(chunks, first);
        codec.insertBeforeEnd(chunks, second);
        assertEquals(size + 2, chunks.size());
        assertEquals(first, chunks.get(size - 1));
        assertEquals(second, chunks.get(size));
        assertEquals(PngChunk.IEND, chunks.get(size + 1).getType());
        byte[] rewritten = codec.writeChunks(chunks);
        assertEquals(chunks, codec.readChunks(rewritten));
        // Still a readable image
        assertEquals(2, codec.decode(rewritten).getWidth());
    }

    @Test
    public void testInsertWithoutEnd() {
        List<PngChunk> chunks = new ArrayList<>();
        chunks.add(new PngChunk("IHDR", new byte[13]));
        try {
            codec.insertBeforeEnd(chunks, new PngChunk("tEXt", new byte[0]));
            fail("should not reach here");
        } catch (IOException x) {
            assertEquals(1, chunks.size());
        }
    }

    @Test
    public void testCorruptFiles() throws IOException {
        byte[] png = codec.encode(pattern(2, 2, Mode.RGBA, 8));
        assertCorrupt(new byte[]{1, 2, 3});
        byte[] badSignature = png.clone();
        badSignature[1] = 'Q';
        assertCorrupt(badSignature);
        byte[] badCrc = png.clone();
        // first byte of IHDR data
        badCrc[16] ^= 0x01;
        assertCorrupt(badCrc);
        byte[] truncated = new byte[png.length - 12];
        System.arraycopy(png, 0, truncated, 0, truncated.length);
        assertCorrupt(truncated);
    }

    @Test(expected = IOException.class)
    public void testWriteRequiresEnd() throws IOException {
        List<PngChunk> chunks = codec.readChunks(codec.encode(pattern(2, 2, Mode.RGB, 8)));
        chunks.remove(chunks.size() - 1);
        codec.writeChunks(chunks);
    }

    @Test
    public void testChunkType() {
        try {
            new PngChunk("iTX", new byte[0]);
            fail("should not reach here");
        } catch (IllegalArgumentException x) {
            // expected
        }
    }

    private void assertCorrupt(byte[] png) {
        try {
            codec.readChunks(png);
            fail("should not reach here");
        } catch (IOException x) {
            // expected
        }
    }

    private static PixelBuffer pattern(int width, int height, Mode mode, int bitDepth) {
        PixelBuffer pixels = new PixelBuffer(width, height, mode, bitDepth);
        int max = pixels.getMaxValue();
        int n = 0;
        for (int row = 0; row < height; row++) {
            for (int column = 0; column < width; column++) {
                for (int channel = 0; channel < mode.getChannels(); channel++) {
                    pixels.setSample(row, column, channel, (n++ * 7919) % (max + 1));
                }
            }
        }
        return pixels;
    }
}
