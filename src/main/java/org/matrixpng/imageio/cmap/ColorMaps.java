package org.matrixpng.imageio.cmap;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.matrixpng.imageio.InvalidConfigurationException;
import org.matrixpng.imageio.Mode;

/**
 * The bundled color maps. Tables are built on first use and cached, since a
 * 16 bit table has 65536 entries.
 *
 * @author tonyj
 */
public class ColorMaps implements ColorMapProvider {

    private static final Logger LOG = Logger.getLogger(ColorMaps.class.getName());
    private static final ColorMaps INSTANCE = new ColorMaps();

    public static final String DEFAULT_COLOR_MAP = "ebb";
    private static final Set<String> AVAILABLE = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(DEFAULT_COLOR_MAP, GreyColorMap.NAME, "b")));

    private final LoadingCache<Key, ColorMap> cache;

    public ColorMaps() {
        cache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger("org.matrixpng.imageio.colorMapCacheSize", 32))
                .recordStats()
                .build(ColorMaps::load);
    }

    public static ColorMaps getInstance() {
        return INSTANCE;
    }

    public Set<String> getAvailableColorMaps() {
        return AVAILABLE;
    }

    @Override
    public ColorMap getColorMap(Mode mode, int bitDepth, String name) {
        if (mode.isColor()) {
            if (!AVAILABLE.contains(name)) {
                throw new InvalidConfigurationException("Unknown color map: " + name);
            }
            return cache.get(new Key(true, bitDepth, name));
        } else {
            return cache.get(new Key(false, bitDepth, GreyColorMap.NAME));
        }
    }

    /**
     * Log the size and hit statistics of the table cache.
     */
    public void report() {
        LOG.log(Level.INFO, "colorMap Cache size {0} stats {1}", new Object[]{cache.estimatedSize(), cache.stats()});
    }

    private static ColorMap load(Key key) {
        LOG.log(Level.FINE, "Building {0} bit color map {1} (color={2})", new Object[]{key.bitDepth, key.name, key.color});
        if (key.color) {
            return new SAOColorMap(key.name, key.bitDepth);
        } else {
            return new GreyColorMap(key.bitDepth);
        }
    }

    private static class Key {

        private final boolean color;
        private final int bitDepth;
        private final String name;

        Key(boolean color, int bitDepth, String name) {
            this.color = color;
            this.bitDepth = bitDepth;
            this.name = name;
        }

        @Override
        public int hashCode() {
            int hash = 7;
            hash = 19 * hash + (color ? 1 : 0);
            hash = 19 * hash + bitDepth;
            hash = 19 * hash + Objects.hashCode(this.name);
            return hash;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (obj == null || getClass() != obj.getClass()) {
                return false;
            }
            final Key other = (Key) obj;
            return color == other.color && bitDepth == other.bitDepth && Objects.equals(this.name, other.name);
        }
    }
}
