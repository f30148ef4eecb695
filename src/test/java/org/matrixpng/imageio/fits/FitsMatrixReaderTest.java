package org.matrixpng.imageio.fits;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.util.BufferedFile;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.matrixpng.imageio.Matrix;
import org.matrixpng.imageio.MatrixImage;
import org.matrixpng.imageio.MatrixImageCodec;
import org.matrixpng.imageio.MetadataKeyword;

/**
 *
 * @author tonyj
 */
public class FitsMatrixReaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testFloatImage() throws IOException, FitsException {
        float[][] data = {{1, 2, 3}, {4, Float.NaN, 6}};
        File file = write("float.fits", Fits.makeHDU(data));
        Matrix matrix = new FitsMatrixReader().read(file);
        assertEquals(2, matrix.getRows());
        assertEquals(3, matrix.getColumns());
        assertEquals(3.0, matrix.get(0, 2), 0);
        assertTrue(Double.isNaN(matrix.get(1, 1)));
        assertEquals(1.0, matrix.min(), 0);
        assertEquals(6.0, matrix.max(), 0);
    }

    @Test
    public void testScaledIntegerImage() throws IOException, FitsException {
        int[][] data = {{0, 1}, {-1, 2}};
        BasicHDU<?> hdu = Fits.makeHDU(data);
        hdu.getHeader().addValue("BSCALE", 0.5, "scale");
        hdu.getHeader().addValue("BZERO", 100.0, "offset");
        hdu.getHeader().addValue("BLANK", -1, "undefined");
        File file = write("int.fits", hdu);
        Matrix matrix = new FitsMatrixReader().read(file);
        assertEquals(100.0, matrix.get(0, 0), 0);
        assertEquals(100.5, matrix.get(0, 1), 0);
        assertTrue(Double.isNaN(matrix.get(1, 0)));
        assertEquals(101.0, matrix.get(1, 1), 0);
    }

    @Test
    public void testUnsignedBytes() throws IOException, FitsException {
        byte[][] data = {{(byte) 200, 10}};
        Matrix matrix = new FitsMatrixReader().read(write("byte.fits", Fits.makeHDU(data)));
        assertEquals(200.0, matrix.get(0, 0), 0);
        assertEquals(10.0, matrix.get(0, 1), 0);
    }

    @Test
    public void testShortAndLongImages() throws IOException, FitsException {
        BasicHDU<?> hdu = Fits.makeHDU(new short[][]{{-32768, 5}, {7, 32767}});
        hdu.getHeader().addValue("BLANK", -32768, "undefined");
        Matrix matrix = new FitsMatrixReader().read(write("short.fits", hdu));
        assertTrue(Double.isNaN(matrix.get(0, 0)));
        assertEquals(5.0, matrix.get(0, 1), 0);
        assertEquals(32767.0, matrix.get(1, 1), 0);

        matrix = new FitsMatrixReader().read(write("long.fits", Fits.makeHDU(new long[][]{{1L << 40, -3}})));
        assertEquals(1, matrix.getRows());
        assertEquals(2, matrix.getColumns());
        assertEquals(Math.pow(2, 40), matrix.get(0, 0), 0);
        assertEquals(-3.0, matrix.get(0, 1), 0);
    }

    @Test
    public void testNoImage() throws IOException, FitsException {
        File file = write("vector.fits", Fits.makeHDU(new float[]{1, 2, 3}));
        try {
            new FitsMatrixReader().read(file);
            fail("should not reach here");
        } catch (IOException x) {
            assertTrue(x.getMessage().contains("No 2-D image"));
        }
    }

    @Test(expected = IOException.class)
    public void testNotFits() throws IOException {
        File file = folder.newFile("text.fits");
        Files.write(file.toPath(), "This is not a FITS file".getBytes(StandardCharsets.US_ASCII));
        new FitsMatrixReader().read(file);
    }

    @Test
    public void testFitsToPng() throws IOException, FitsException {
        double[][] data = new double[16][32];
        for (int y = 0; y < data.length; y++) {
            for (int x = 0; x < data[y].length; x++) {
                data[y][x] = x * y;
            }
        }
        Matrix matrix = new FitsMatrixReader().read(write("double.fits", Fits.makeHDU(data)));
        MatrixImageCodec codec = new MatrixImageCodec();
        // FITS images are indexed [y][x]
        MatrixImage image = codec.read(codec.write(matrix, false));
        assertEquals(32, image.getPixels().getWidth());
        assertEquals(16, image.getPixels().getHeight());
        assertEquals(Integer.valueOf(32), image.getScale().get(MetadataKeyword.X_MAX));
        assertEquals(465.0, image.getScale().getZMax(), 0);
    }

    private File write(String name, BasicHDU<?> hdu) throws IOException, FitsException {
        File file = new File(folder.getRoot(), name);
        Fits fits = new Fits();
        fits.addHDU(hdu);
        try (BufferedFile out = new BufferedFile(file, "rw")) {
            fits.write(out);
        } finally {
            fits.close();
        }
        return file;
    }
}
