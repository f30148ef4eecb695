package org.matrixpng.imageio;

/**
 * The channel layout of the image.
 *
 * @author tonyj
 */
public enum Mode {

    GRAY("L", 1, false),
    GRAY_ALPHA("LA", 2, true),
    RGB("RGB", 3, false),
    RGBA("RGBA", 4, true);

    private final String shortName;
    private final int channels;
    private final boolean alpha;

    Mode(String shortName, int channels, boolean alpha) {
        this.shortName = shortName;
        this.channels = channels;
        this.alpha = alpha;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * @return The total number of channels, including alpha
     */
    public int getChannels() {
        return channels;
    }

    /**
     * @return The number of channels written from a color map entry
     */
    public int getColorChannels() {
        return alpha ? channels - 1 : channels;
    }

    public boolean hasAlpha() {
        return alpha;
    }

    public boolean isColor() {
        return getColorChannels() > 1;
    }

    /**
     * Look up a mode either by its short name (L, LA, RGB, RGBA) or by its
     * enum name.
     *
     * @param name The name to look up
     * @return The corresponding mode
     * @throws InvalidConfigurationException if the name is unknown
     */
    public static Mode fromName(String name) {
        for (Mode mode : values()) {
            if (mode.shortName.equals(name) || mode.name().equals(name)) {
                return mode;
            }
        }
        throw new InvalidConfigurationException("Mode " + name + " is unknown.");
    }

    /**
     * Find the mode with the given channel count.
     *
     * @param channels The number of channels
     * @return The corresponding mode
     * @throws InvalidConfigurationException if no mode has that many channels
     */
    public static Mode forChannels(int channels) {
        for (Mode mode : values()) {
            if (mode.channels == channels) {
                return mode;
            }
        }
        throw new InvalidConfigurationException("No mode with " + channels + " channels");
    }
}
