package org.matrixpng.imageio.cmap;

import org.matrixpng.imageio.Mode;

/**
 * Supplies the color table used for a given mode, bit depth and map name.
 *
 * @author tonyj
 */
public interface ColorMapProvider {

    /**
     * @param mode The image mode
     * @param bitDepth The bits per channel
     * @param name The color map name, ignored for gray modes
     * @return A non-empty table whose entries have
     * <code>mode.getColorChannels()</code> channels
     * @throws org.matrixpng.imageio.InvalidConfigurationException if no such
     * map exists
     */
    ColorMap getColorMap(Mode mode, int bitDepth, String name);
}
