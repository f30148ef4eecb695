package org.matrixpng.imageio.fits;

import java.io.File;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.ImageData;
import nom.tam.fits.ImageHDU;
import nom.tam.fits.header.Standard;
import org.matrixpng.imageio.Matrix;

/**
 * Reads the first 2-D image in a FITS file into a {@link Matrix}, indexed
 * <code>[NAXIS2][NAXIS1]</code>, so y is the first axis. BSCALE and BZERO are
 * applied and BLANK pixels become NaN.
 *
 * @author tonyj
 */
public class FitsMatrixReader {

    private static final Logger LOG = Logger.getLogger(FitsMatrixReader.class.getName());

    public Matrix read(File file) throws IOException {
        Fits fits;
        try {
            fits = new Fits(file);
        } catch (FitsException x) {
            throw new IOException("Unable to open " + file, x);
        }
        try {
            for (;;) {
                BasicHDU<?> hdu = fits.readHDU();
                if (hdu == null) {
                    throw new IOException("No 2-D image found in " + file);
                }
                if (hdu instanceof ImageHDU imageHDU) {
                    int[] axes = imageHDU.getAxes();
                    if (axes != null && axes.length == 2) {
                        LOG.log(Level.FINE, "Reading {0}x{1} image from {2}", new Object[]{axes[1], axes[0], file});
                        return toMatrix(imageHDU);
                    }
                }
            }
        } catch (FitsException x) {
            throw new IOException("Invalid FITS file " + file, x);
        } finally {
            fits.close();
        }
    }

    private static Matrix toMatrix(ImageHDU hdu) throws FitsException, IOException {
        Header header = hdu.getHeader();
        double bscale = header.getDoubleValue(Standard.BSCALE, 1.0);
        double bzero = header.getDoubleValue(Standard.BZERO, 0.0);
        boolean hasBlank = header.containsKey(Standard.BLANK.key());
        long blank = hasBlank ? header.getLongValue(Standard.BLANK.key()) : 0;

        ImageData data = hdu.getData();
        // A 2-D kernel is an array of primitive rows
        Object[] lines = (Object[]) data.getKernel();
        if (lines.length == 0) {
            throw new IOException("Empty image");
        }
        double[] first = toDoubles(lines[0], bscale, bzero, hasBlank, blank);
        int columns = first.length;
        double[] values = new double[lines.length * columns];
        System.arraycopy(first, 0, values, 0, columns);
        for (int row = 1; row < lines.length; row++) {
            System.arraycopy(toDoubles(lines[row], bscale, bzero, hasBlank, blank), 0, values, row * columns, columns);
        }
        return new Matrix(lines.length, columns, values);
    }

    private static double[] toDoubles(Object line, double bscale, double bzero, boolean hasBlank, long blank) throws IOException {
        if (line instanceof float[] f) {
            double[] result = new double[f.length];
            for (int i = 0; i < f.length; i++) {
                result[i] = bzero + bscale * f[i];
            }
            return result;
        } else if (line instanceof double[] d) {
            double[] result = new double[d.length];
            for (int i = 0; i < d.length; i++) {
                result[i] = bzero + bscale * d[i];
            }
            return result;
        }
        long[] raw;
        if (line instanceof byte[] b) {
            raw = new long[b.length];
            for (int i = 0; i < b.length; i++) {
                // BITPIX 8 is unsigned
                raw[i] = b[i] & 0xff;
            }
        } else if (line instanceof short[] s) {
            raw = new long[s.length];
            for (int i = 0; i < s.length; i++) {
                raw[i] = s[i];
            }
        } else if (line instanceof int[] n) {
            raw = new long[n.length];
            for (int i = 0; i < n.length; i++) {
                raw[i] = n[i];
            }
        } else if (line instanceof long[] l) {
            raw = l;
        } else {
            throw new IOException("Unsupported FITS data type: " + line.getClass().getSimpleName());
        }
        double[] result = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            result[i] = hasBlank && raw[i] == blank ? Double.NaN : bzero + bscale * raw[i];
        }
        return result;
    }
}
