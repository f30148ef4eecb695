package org.matrixpng.imageio.png;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.imageio.ImageIO;
import org.matrixpng.imageio.Mode;
import org.matrixpng.imageio.PixelBuffer;

/**
 * PNG files, with pixels encoded and decoded by the javax.imageio PNG plugin
 * and chunks framed here.
 *
 * @author tonyj
 */
public class PngContainerCodec implements ImageContainerCodec {

    private static final Logger LOG = Logger.getLogger(PngContainerCodec.class.getName());
    static final byte[] SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n'};

    @Override
    public byte[] encode(PixelBuffer pixels) throws IOException {
        Mode mode = pixels.getMode();
        int dataType;
        switch (pixels.getBitDepth()) {
            case 8:
                dataType = DataBuffer.TYPE_BYTE;
                break;
            case 16:
                dataType = DataBuffer.TYPE_USHORT;
                break;
            default:
                throw new IOException("Unsupported bit depth: " + pixels.getBitDepth());
        }
        ColorSpace cs = ColorSpace.getInstance(mode.isColor() ? ColorSpace.CS_sRGB : ColorSpace.CS_GRAY);
        ColorModel cm = new ComponentColorModel(cs, mode.hasAlpha(), false,
                mode.hasAlpha() ? Transparency.TRANSLUCENT : Transparency.OPAQUE, dataType);
        WritableRaster raster = cm.createCompatibleWritableRaster(pixels.getWidth(), pixels.getHeight());
        raster.setPixels(0, 0, pixels.getWidth(), pixels.getHeight(), pixels.getSamples());
        BufferedImage image = new BufferedImage(cm, raster, false, null);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer available for " + pixels);
        }
        return out.toByteArray();
    }

    @Override
    public PixelBuffer decode(byte[] png) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        if (image == null) {
            throw new IOException("Not a readable PNG image");
        }
        ColorModel cm = image.getColorModel();
        if (!(cm instanceof ComponentColorModel)) {
            return toRGB(image);
        }
        Raster raster = image.getRaster();
        Mode mode = Mode.forChannels(raster.getNumBands());
        int bitDepth = cm.getComponentSize(0);
        int[] samples = raster.getPixels(0, 0, raster.getWidth(), raster.getHeight(), (int[]) null);
        LOG.log(Level.FINE, "Decoded {0}x{1} {2} image, {3} bits", new Object[]{raster.getWidth(), raster.getHeight(), mode, bitDepth});
        return new PixelBuffer(raster.getWidth(), raster.getHeight(), mode, bitDepth, samples);
    }

    /**
     * Palette images come back as 8 bit RGB, or RGBA if the palette has
     * transparency.
     */
    private static PixelBuffer toRGB(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        Mode mode = image.getColorModel().hasAlpha() ? Mode.RGBA : Mode.RGB;
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        PixelBuffer pixels = new PixelBuffer(width, height, mode, 8);
        for (int row = 0; row < height; row++) {
            for (int column = 0; column < width; column++) {
                int rgb = argb[row * width + column];
                pixels.setSample(row, column, 0, (rgb >> 16) & 0xff);
                pixels.setSample(row, column, 1, (rgb >> 8) & 0xff);
                pixels.setSample(row, column, 2, rgb & 0xff);
                if (mode.hasAlpha()) {
                    pixels.setSample(row, column, 3, (rgb >>> 24) & 0xff);
                }
            }
        }
        LOG.log(Level.FINE, "Converted {0}x{1} {2} image to {3}", new Object[]{width, height, image.getColorModel().getClass().getSimpleName(), mode});
        return pixels;
    }

    @Override
    public List<PngChunk> readChunks(byte[] png) throws IOException {
        List<PngChunk> result = new ArrayList<>();
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(png))) {
            byte[] signature = new byte[SIGNATURE.length];
            in.readFully(signature);
            if (!Arrays.equals(signature, SIGNATURE)) {
                throw new IOException("Missing PNG signature");
            }
            for (;;) {
                int length = in.readInt();
                if (length < 0 || length > in.available()) {
                    throw new IOException("Invalid chunk length: " + (length & 0xffffffffL));
                }
                byte[] type = new byte[4];
                in.readFully(type);
                byte[] data = new byte[length];
                in.readFully(data);
                int crc = in.readInt();
                PngChunk chunk;
                try {
                    chunk = new PngChunk(new String(type, StandardCharsets.ISO_8859_1), data);
                } catch (IllegalArgumentException x) {
                    throw new IOException("Corrupt chunk header", x);
                }
                if (chunk.crc() != crc) {
                    throw new IOException("CRC mismatch in " + chunk.getType() + " chunk");
                }
                result.add(chunk);
                if (PngChunk.IEND.equals(chunk.getType())) {
                    break;
                }
            }
        } catch (EOFException x) {
            throw new IOException("Truncated PNG, no " + PngChunk.IEND + " chunk", x);
        }
        return result;
    }

    @Override
    public byte[] writeChunks(List<PngChunk> chunks) throws IOException {
        if (chunks.isEmpty() || !PngChunk.IEND.equals(chunks.get(chunks.size() - 1).getType())) {
            throw new IOException("Chunk list must end with " + PngChunk.IEND);
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(buffer)) {
            out.write(SIGNATURE);
            for (PngChunk chunk : chunks) {
                out.writeInt(chunk.getLength());
                out.write(chunk.getType().getBytes(StandardCharsets.US_ASCII));
                out.write(chunk.getData());
                out.writeInt(chunk.crc());
            }
        }
        return buffer.toByteArray();
    }
}
