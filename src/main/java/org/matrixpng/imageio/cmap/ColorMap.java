package org.matrixpng.imageio.cmap;

import java.util.Arrays;

/**
 * An immutable, ordered table of colors. The table length is the number of
 * quantization levels available to an image using it.
 *
 * @author tonyj
 */
public abstract class ColorMap {

    private final String name;
    private final int size;
    private final int channels;
    private final int bitDepth;
    private final int[] table;

    protected ColorMap(String name, int bitDepth, int channels) {
        this.name = name;
        this.size = 1 << bitDepth;
        this.channels = channels;
        this.bitDepth = bitDepth;
        this.table = new int[size * channels];
    }

    public String getName() {
        return name;
    }

    public int getSize() {
        return size;
    }

    public int getChannels() {
        return channels;
    }

    public int getBitDepth() {
        return bitDepth;
    }

    public int getMaxValue() {
        return size - 1;
    }

    public int getSample(int index, int channel) {
        return table[index * channels + channel];
    }

    /**
     * @param index The palette index
     * @return A copy of the channel values of one entry
     */
    public int[] getColor(int index) {
        return Arrays.copyOfRange(table, index * channels, (index + 1) * channels);
    }

    /**
     * Populate the table, called once by subclasses during construction.
     */
    protected void setSample(int index, int channel, int value) {
        table[index * channels + channel] = value;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + "name=" + name + ", size=" + size + ", channels=" + channels + '}';
    }
}
