package org.matrixpng.imageio.cmap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads an SAO colormap file (as read/written by ds9) and samples it into a
 * table of 2^bitDepth RGB entries.
 *
 * @author tonyj
 */
public class SAOColorMap extends ColorMap {

    private static final Pattern COORD_PATTERN = Pattern.compile("\\(([0-9.]+),([0-9.]+)\\)");

    private enum ColorScheme {
        PSEUDOCOLOR
    };

    private enum Color {
        RED, GREEN, BLUE
    };

    /**
     * @param name The map name, also used to find the resource
     * <code>name.sao</code> next to this class
     * @param bitDepth The bits per channel of the table entries
     */
    public SAOColorMap(String name, int bitDepth) {
        super(name, bitDepth, Color.values().length);
        String resource = name + ".sao";
        try (InputStream input = SAOColorMap.class.getResourceAsStream(resource)) {
            if (input == null) {
                throw new RuntimeException("Missing sao file: " + resource);
            }
            LineProvider lines = new LineProvider(input);
            ColorScheme colorScheme = ColorScheme.valueOf(lines.nextLine());
            switch (colorScheme) {
                case PSEUDOCOLOR:
                    Map<Color, Interpolation> cmap = new EnumMap<>(Color.class);
                    Color currentColor = null;
                    Interpolation currentInterpolation = null;
                    for (;;) {
                        String line = lines.nextLine();
                        if (line == null) {
                            if (currentColor != null) {
                                cmap.put(currentColor, currentInterpolation);
                            }
                            break;
                        }
                        if (line.endsWith(":")) {
                            if (currentColor != null) {
                                cmap.put(currentColor, currentInterpolation);
                            }
                            currentColor = Color.valueOf(line.replace(":", ""));
                            currentInterpolation = new Interpolation();
                        } else {
                            if (currentColor == null || currentInterpolation == null) {
                                throw new RuntimeException("Missing color line in " + resource);
                            }
                            currentInterpolation.readPoints(line);
                        }
                    }
                    if (cmap.size() != Color.values().length) {
                        throw new RuntimeException("Colormap " + resource + " must define " + List.of(Color.values()));
                    }
                    convertToCMap(cmap);
                    break;

                default:
                    throw new RuntimeException("Unsupported color scheme: " + colorScheme);
            }
        } catch (IOException | IllegalArgumentException x) {
            throw new RuntimeException("Invalid colormap " + resource, x);
        }
    }

    private void convertToCMap(Map<Color, Interpolation> cmap) {
        int size = getSize();
        for (int i = 0; i < size; i++) {
            float f = i / (size - 1.0f);
            for (Color color : Color.values()) {
                setSample(i, color.ordinal(), Math.round((size - 1) * cmap.get(color).get(f)));
            }
        }
    }

    private static class Interpolation {

        private final List<Float> x = new ArrayList<>();
        private final List<Float> y = new ArrayList<>();

        float get(float value) {
            int binarySearch = Collections.binarySearch(x, value);
            if (binarySearch >= 0) {
                return y.get(binarySearch);
            }
            int insertion = -binarySearch - 1;
            if (insertion == 0) {
                return y.get(0);
            } else if (insertion == x.size()) {
                return y.get(x.size() - 1);
            } else {
                float y1 = y.get(-binarySearch - 2);
                float y2 = y.get(-binarySearch - 1);
                float x1 = x.get(-binarySearch - 2);
                float x2 = x.get(-binarySearch - 1);
                return y1 + (y2 - y1) * (value - x1) / (x2 - x1);
            }
        }

        void readPoints(String line) throws IOException {
            Matcher matcher = COORD_PATTERN.matcher(line);
            while (matcher.find()) {
                float f1 = Float.parseFloat(matcher.group(1));
                float f2 = Float.parseFloat(matcher.group(2));
                if (!x.isEmpty() && f1 <= x.get(x.size() - 1)) {
                    throw new IOException("Points must be in increasing order: " + line);
                }
                x.add(f1);
                y.add(f2);
            }
        }
    }

    private static class LineProvider {

        private final BufferedReader reader;

        LineProvider(InputStream input) {
            reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.US_ASCII));
        }

        String nextLine() throws IOException {
            for (;;) {
                String line = reader.readLine();
                if (line == null) {
                    return null;
                }
                String[] tokens = line.split("#", 2);
                String commentRemoved = tokens[0].trim();
                if (commentRemoved.isEmpty()) {
                    continue;
                }
                return commentRemoved;
            }
        }
    }
}
