package org.matrixpng.imageio;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.matrixpng.imageio.cmap.ColorMap;
import org.matrixpng.imageio.cmap.ColorMapProvider;
import org.matrixpng.imageio.cmap.ColorMaps;
import org.matrixpng.imageio.png.ImageContainerCodec;
import org.matrixpng.imageio.png.PngChunk;
import org.matrixpng.imageio.png.PngContainerCodec;
import org.matrixpng.imageio.quantize.ColorQuantizer;
import org.matrixpng.imageio.quantize.OutOfRangePolicy;
import org.matrixpng.imageio.text.CompressionMethod;
import org.matrixpng.imageio.text.TextChunk;
import org.matrixpng.imageio.text.TextChunkCodec;

/**
 * Writes a matrix as a false-color PNG whose text metadata records its scale,
 * and reads that metadata back.
 *
 * <p>
 * Mode, bit depth and color map are validated as soon as they are set, and
 * each change re-resolves the color table through {@link #reconfigure()}.
 * Scale ranges that are left unset are filled in from the matrix on every
 * write without changing this codec's configuration.
 *
 * @author tonyj
 */
public class MatrixImageCodec {

    private static final Logger LOG = Logger.getLogger(MatrixImageCodec.class.getName());

    public static final Set<Integer> SUPPORTED_BIT_DEPTHS = Set.of(8, 16);
    public static final String Y_ASCEND_UP = "up";
    public static final String Y_ASCEND_DOWN = "down";

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?(NaN|Infinity|(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?)");

    private final ColorMapProvider colorMaps;
    private final ImageContainerCodec container;
    private Mode mode;
    private int bitDepth;
    private ScaleConfig scale = new ScaleConfig();
    private ColorMap colorMap;
    private boolean compressMetadata = true;
    private String languageTag = TextChunk.DEFAULT_LANGUAGE;
    private OutOfRangePolicy outOfRangePolicy = OutOfRangePolicy.CLIP;

    public MatrixImageCodec() {
        this(Mode.RGB, 8);
    }

    public MatrixImageCodec(Mode mode, int bitDepth) {
        this(mode, bitDepth, ColorMaps.getInstance(), new PngContainerCodec());
    }

    public MatrixImageCodec(Mode mode, int bitDepth, ColorMapProvider colorMaps, ImageContainerCodec container) {
        this.colorMaps = Objects.requireNonNull(colorMaps, "colorMaps");
        this.container = Objects.requireNonNull(container, "container");
        this.mode = checkMode(mode);
        this.bitDepth = checkBitDepth(bitDepth);
        this.scale.setColorMapName(ColorMaps.DEFAULT_COLOR_MAP);
        reconfigure();
    }

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        Mode previous = this.mode;
        this.mode = checkMode(mode);
        reconfigure(() -> this.mode = previous);
    }

    /**
     * @param mode One of L, LA, RGB, RGBA
     */
    public void setMode(String mode) {
        setMode(Mode.fromName(mode));
    }

    public int getBitDepth() {
        return bitDepth;
    }

    public void setBitDepth(int bitDepth) {
        int previous = this.bitDepth;
        this.bitDepth = checkBitDepth(bitDepth);
        reconfigure(() -> this.bitDepth = previous);
    }

    public String getColorMapName() {
        return scale.getColorMapName();
    }

    public void setColorMapName(String name) {
        String previous = scale.getColorMapName();
        scale.setColorMapName(Objects.requireNonNull(name, "name"));
        reconfigure(() -> scale.setColorMapName(previous));
    }

    /**
     * @return The color table currently in use
     */
    public ColorMap getColorMap() {
        return colorMap;
    }

    public int getQuantizationLevels() {
        return colorMap.getSize();
    }

    /**
     * @return A copy of the current scale configuration
     */
    public ScaleConfig getScaleConfig() {
        return new ScaleConfig(scale);
    }

    /**
     * Replace the scale configuration. A null color map name selects the
     * default map.
     */
    public void setScaleConfig(ScaleConfig config) {
        ScaleConfig previous = scale;
        scale = new ScaleConfig(config);
        if (scale.getColorMapName() == null) {
            scale.setColorMapName(ColorMaps.DEFAULT_COLOR_MAP);
        }
        reconfigure(() -> scale = previous);
    }

    /**
     * Update only the fields populated in <code>updates</code>.
     */
    public void setScaling(ScaleConfig updates) {
        ScaleConfig previous = new ScaleConfig(scale);
        scale.merge(updates);
        reconfigure(() -> scale = previous);
    }

    public boolean isCompressMetadata() {
        return compressMetadata;
    }

    public void setCompressMetadata(boolean compressMetadata) {
        this.compressMetadata = compressMetadata;
    }

    public String getLanguageTag() {
        return languageTag;
    }

    public void setLanguageTag(String languageTag) {
        if (languageTag == null || languageTag.indexOf('\0') >= 0 || !StandardCharsets.US_ASCII.newEncoder().canEncode(languageTag)) {
            throw new InvalidConfigurationException("Invalid language tag: " + languageTag);
        }
        this.languageTag = languageTag;
    }

    public OutOfRangePolicy getOutOfRangePolicy() {
        return outOfRangePolicy;
    }

    public void setOutOfRangePolicy(OutOfRangePolicy outOfRangePolicy) {
        this.outOfRangePolicy = Objects.requireNonNull(outOfRangePolicy, "outOfRangePolicy");
    }

    /**
     * Resolve the color table for the current mode, bit depth and color map
     * name.
     *
     * @throws InvalidConfigurationException if the provider has no suitable
     * table
     */
    public final void reconfigure() {
        ColorMap resolved = colorMaps.getColorMap(mode, bitDepth, scale.getColorMapName());
        if (resolved.getSize() < 1 || resolved.getChannels() != mode.getColorChannels() || resolved.getBitDepth() != bitDepth) {
            throw new InvalidConfigurationException("Color map " + resolved + " does not suit " + mode + " at " + bitDepth + " bits");
        }
        colorMap = resolved;
        LOG.log(Level.FINE, "Using {0} for {1} {2} bit", new Object[]{colorMap, mode, bitDepth});
    }

    private void reconfigure(Runnable rollback) {
        try {
            reconfigure();
        } catch (RuntimeException x) {
            rollback.run();
            throw x;
        }
    }

    /**
     * Build a complete PNG file for a matrix.
     *
     * @param matrix The values to write
     * @param xAxisFirst Whether the first matrix axis is x (so rows become
     * image columns)
     * @return The PNG bytes
     * @throws IOException If the image cannot be encoded
     * @throws InvalidConfigurationException if the z range is unusable
     */
    public byte[] write(Matrix matrix, boolean xAxisFirst) throws IOException {
        return Timed.execute(() -> {
            ScaleConfig resolved = scale.resolve(matrix, xAxisFirst);
            LOG.log(Level.FINE, "Resolved scale {0}", resolved);
            PixelBuffer pixels = toPixelBuffer(matrix, resolved, xAxisFirst);
            List<PngChunk> chunks = container.readChunks(container.encode(pixels));
            for (TextChunk record : metadataRecords(resolved)) {
                container.insertBeforeEnd(chunks, new PngChunk(TextChunkCodec.CHUNK_TYPE, TextChunkCodec.encode(record)));
            }
            return container.writeChunks(chunks);
        }, "Writing %dx%d matrix took %dms", matrix.getRows(), matrix.getColumns());
    }

    public void write(Matrix matrix, OutputStream out, boolean xAxisFirst) throws IOException {
        out.write(write(matrix, xAxisFirst));
    }

    public void write(Matrix matrix, File file, boolean xAxisFirst) throws IOException {
        Files.write(file.toPath(), write(matrix, xAxisFirst));
    }

    /**
     * Quantize a matrix into pixels, oriented so that row 0 is the top of the
     * image.
     *
     * @param matrix The values to convert
     * @param xAxisFirst Whether the first matrix axis is x
     * @return The pixels
     */
    public PixelBuffer toPixelBuffer(Matrix matrix, boolean xAxisFirst) {
        return toPixelBuffer(matrix, scale.resolve(matrix, xAxisFirst), xAxisFirst);
    }

    PixelBuffer toPixelBuffer(Matrix matrix, ScaleConfig resolved, boolean xAxisFirst) {
        ColorQuantizer quantizer = new ColorQuantizer(resolved.getZMin(), resolved.getZMax(), colorMap.getSize(), outOfRangePolicy);
        int colorChannels = mode.getColorChannels();
        int[] nanColor = new int[colorChannels];
        Arrays.fill(nanColor, ColorQuantizer.nanSample(mode, bitDepth));

        PixelBuffer pixels = new PixelBuffer(matrix.getColumns(), matrix.getRows(), mode, bitDepth);
        // Alpha stays fully opaque
        pixels.fill(pixels.getMaxValue());
        for (int row = 0; row < matrix.getRows(); row++) {
            for (int column = 0; column < matrix.getColumns(); column++) {
                double value = matrix.get(row, column);
                if (ColorQuantizer.isNaN(value)) {
                    pixels.setColor(row, column, nanColor, colorChannels);
                } else {
                    pixels.setColor(row, column, colorMap.getColor(quantizer.quantize(value)), colorChannels);
                }
            }
        }
        if (xAxisFirst) {
            pixels = pixels.transpose();
        }
        if (resolved.isYAscendsUpward()) {
            pixels = pixels.flipVertical();
        }
        return pixels;
    }

    /**
     * The records written for a resolved scale: every populated scale field in
     * keyword order, the color map name (color modes only), then the y
     * orientation.
     */
    List<TextChunk> metadataRecords(ScaleConfig resolved) {
        List<TextChunk> records = new ArrayList<>();
        for (MetadataKeyword keyword : MetadataKeyword.SCALE_FIELDS) {
            if (resolved.isSet(keyword)) {
                records.add(record(keyword, resolved.getText(keyword)));
            }
        }
        if (mode.isColor()) {
            records.add(record(MetadataKeyword.COLORMAP, resolved.getColorMapName()));
        }
        records.add(record(MetadataKeyword.Y_ASCEND, resolved.isYAscendsUpward() ? Y_ASCEND_UP : Y_ASCEND_DOWN));
        return records;
    }

    private TextChunk record(MetadataKeyword keyword, String text) {
        return new TextChunk(keyword.getKeyword(), compressMetadata, CompressionMethod.ZLIB, languageTag, keyword.getKeyword(), text);
    }

    /**
     * Recover the scale metadata and raw pixels of a PNG file. Matrix values
     * are not reconstructed.
     *
     * @param png The PNG bytes
     * @return The recovered metadata and pixels
     * @throws IOException If the file or one of its text records is invalid
     */
    public MatrixImage read(byte[] png) throws IOException {
        return Timed.execute(() -> {
            ScaleConfig result = new ScaleConfig();
            for (PngChunk chunk : container.readChunks(png)) {
                if (TextChunkCodec.CHUNK_TYPE.equals(chunk.getType())) {
                    apply(result, TextChunkCodec.decode(chunk.getData()));
                }
            }
            return new MatrixImage(result, container.decode(png));
        }, "Reading %d byte image took %dms", png.length);
    }

    public MatrixImage read(File file) throws IOException {
        return read(Files.readAllBytes(file.toPath()));
    }

    private static void apply(ScaleConfig config, TextChunk record) {
        String text = record.getText();
        MetadataKeyword keyword = MetadataKeyword.of(record.getKeyword());
        switch (keyword) {
            case COLORMAP:
                config.setColorMapName(text);
                break;
            case Y_ASCEND:
                if (Y_ASCEND_UP.equals(text)) {
                    config.setYAscendsUpward(true);
                } else if (Y_ASCEND_DOWN.equals(text)) {
                    config.setYAscendsUpward(false);
                } else {
                    LOG.log(Level.WARNING, "Ignoring unknown y_ascend value {0}", text);
                }
                break;
            case UNRECOGNIZED:
                LOG.log(Level.FINE, "Keeping unrecognized keyword {0}", record.getKeyword());
                config.putUnrecognized(record.getKeyword(), text);
                break;
            default:
                config.set(keyword, parseValue(text));
        }
    }

    /**
     * Interpret text as an integer, else a floating point number, else leave
     * it as text.
     */
    static Object parseValue(String text) {
        if (INTEGER_PATTERN.matcher(text).matches()) {
            BigInteger value = new BigInteger(text);
            if (value.bitLength() < Integer.SIZE) {
                return value.intValue();
            } else if (value.bitLength() < Long.SIZE) {
                return value.longValue();
            }
            return value;
        }
        if (DECIMAL_PATTERN.matcher(text).matches()) {
            return Double.valueOf(text);
        }
        return text;
    }

    private static Mode checkMode(Mode mode) {
        if (mode == null) {
            throw new InvalidConfigurationException("Mode must be one of " + Arrays.toString(Mode.values()));
        }
        return mode;
    }

    private static int checkBitDepth(int bitDepth) {
        if (!SUPPORTED_BIT_DEPTHS.contains(bitDepth)) {
            throw new InvalidConfigurationException("Bit depth " + bitDepth + " is unsupported.");
        }
        return bitDepth;
    }
}
