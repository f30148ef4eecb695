package org.matrixpng.imageio;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The numeric ranges and units describing how pixel positions and colors map
 * back to physical x, y and z quantities, plus the color map name and y axis
 * orientation. Every field is optional; unset fields are filled in by
 * {@link #resolve(Matrix, boolean)} when an image is written.
 *
 * <p>
 * Scale values are held as either a {@link Number} or a {@link String}. Values
 * recovered from an image keep whichever type their text parsed as.
 *
 * @author tonyj
 */
public class ScaleConfig {

    private final Map<MetadataKeyword, Object> values = new EnumMap<>(MetadataKeyword.class);
    private final Map<String, String> unrecognized = new LinkedHashMap<>();
    private String colorMapName;
    private Boolean yAscendsUpward;

    public ScaleConfig() {
    }

    public ScaleConfig(ScaleConfig other) {
        this.values.putAll(other.values);
        this.unrecognized.putAll(other.unrecognized);
        this.colorMapName = other.colorMapName;
        this.yAscendsUpward = other.yAscendsUpward;
    }

    public Object get(MetadataKeyword key) {
        return values.get(checkScaleField(key));
    }

    /**
     * Set (or with null, clear) one scale field.
     *
     * @param key A scale field
     * @param value A Number, a String, or null
     */
    public void set(MetadataKeyword key, Object value) {
        checkScaleField(key);
        if (value == null) {
            values.remove(key);
        } else if (value instanceof Number || value instanceof String) {
            values.put(key, value);
        } else {
            throw new IllegalArgumentException("Scale value for " + key.getKeyword() + " must be a Number or String: " + value);
        }
    }

    public boolean isSet(MetadataKeyword key) {
        return values.containsKey(checkScaleField(key));
    }

    /**
     * @return The value as a Double, or null if unset or not numeric
     */
    public Double getNumber(MetadataKeyword key) {
        Object value = get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    /**
     * @return The value converted to text, or null if unset
     */
    public String getText(MetadataKeyword key) {
        Object value = get(key);
        return value == null ? null : value.toString();
    }

    public Double getZMin() {
        return getNumber(MetadataKeyword.Z_MIN);
    }

    public void setZMin(Double zMin) {
        set(MetadataKeyword.Z_MIN, zMin);
    }

    public Double getZMax() {
        return getNumber(MetadataKeyword.Z_MAX);
    }

    public void setZMax(Double zMax) {
        set(MetadataKeyword.Z_MAX, zMax);
    }

    public String getZUnits() {
        return getText(MetadataKeyword.Z_UNITS);
    }

    public void setZUnits(String zUnits) {
        set(MetadataKeyword.Z_UNITS, zUnits);
    }

    public String getColorMapName() {
        return colorMapName;
    }

    public void setColorMapName(String colorMapName) {
        this.colorMapName = colorMapName;
    }

    /**
     * @return Whether y increases upward in the stored image, true unless
     * explicitly set otherwise
     */
    public boolean isYAscendsUpward() {
        return yAscendsUpward == null || yAscendsUpward;
    }

    public void setYAscendsUpward(Boolean yAscendsUpward) {
        this.yAscendsUpward = yAscendsUpward;
    }

    boolean isYAscendsUpwardSet() {
        return yAscendsUpward != null;
    }

    /**
     * @return Keywords read from an image that this codec does not know,
     * with their text
     */
    public Map<String, String> getUnrecognized() {
        return Collections.unmodifiableMap(unrecognized);
    }

    public void putUnrecognized(String keyword, String text) {
        unrecognized.put(keyword, text);
    }

    /**
     * Copy every populated field of <code>other</code> into this config,
     * leaving the remaining fields untouched.
     *
     * @param other The fields to apply
     */
    public void merge(ScaleConfig other) {
        values.putAll(other.values);
        unrecognized.putAll(other.unrecognized);
        if (other.colorMapName != null) {
            colorMapName = other.colorMapName;
        }
        if (other.yAscendsUpward != null) {
            yAscendsUpward = other.yAscendsUpward;
        }
    }

    /**
     * Fill in every unset range from the matrix and check that the z range
     * can be quantized. This config is not modified.
     *
     * @param matrix The matrix about to be written
     * @param xAxisFirst Whether the matrix's first axis is x
     * @return A new, fully populated config
     * @throws InvalidConfigurationException if z_min and z_max are not
     * numbers with z_max &gt; z_min
     */
    public ScaleConfig resolve(Matrix matrix, boolean xAxisFirst) {
        ScaleConfig result = new ScaleConfig(this);
        int xExtent = xAxisFirst ? matrix.getRows() : matrix.getColumns();
        int yExtent = xAxisFirst ? matrix.getColumns() : matrix.getRows();
        if (!isSet(MetadataKeyword.Z_MIN)) {
            result.set(MetadataKeyword.Z_MIN, matrix.min());
        }
        if (!isSet(MetadataKeyword.Z_MAX)) {
            result.set(MetadataKeyword.Z_MAX, matrix.max());
        }
        if (!isSet(MetadataKeyword.X_MIN)) {
            result.set(MetadataKeyword.X_MIN, 0);
        }
        if (!isSet(MetadataKeyword.X_MAX)) {
            result.set(MetadataKeyword.X_MAX, xExtent);
        }
        if (!isSet(MetadataKeyword.Y_MIN)) {
            result.set(MetadataKeyword.Y_MIN, 0);
        }
        if (!isSet(MetadataKeyword.Y_MAX)) {
            result.set(MetadataKeyword.Y_MAX, yExtent);
        }
        Double zMin = result.getZMin();
        Double zMax = result.getZMax();
        if (zMin == null || zMax == null) {
            throw new InvalidConfigurationException("z_min and z_max must be numeric: " + result.get(MetadataKeyword.Z_MIN) + ", " + result.get(MetadataKeyword.Z_MAX));
        }
        // z is always stored as floating point
        result.set(MetadataKeyword.Z_MIN, zMin);
        result.set(MetadataKeyword.Z_MAX, zMax);
        if (Double.isNaN(zMin) || Double.isNaN(zMax)) {
            throw new InvalidConfigurationException("No z range available, matrix has no finite values and z_min/z_max are unset");
        }
        if (Double.isInfinite(zMin) || Double.isInfinite(zMax)) {
            throw new InvalidConfigurationException("z range must be finite: " + zMin + " to " + zMax);
        }
        if (!(zMax > zMin)) {
            throw new InvalidConfigurationException("z_max (" + zMax + ") must be greater than z_min (" + zMin + ")");
        }
        return result;
    }

    private static MetadataKeyword checkScaleField(MetadataKeyword key) {
        if (!key.isScaleField()) {
            throw new IllegalArgumentException("Not a scale field: " + key);
        }
        return key;
    }

    @Override
    public String toString() {
        return "ScaleConfig{" + "values=" + values + ", colorMapName=" + colorMapName + ", yAscendsUpward=" + yAscendsUpward + ", unrecognized=" + unrecognized + '}';
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 37 * hash + Objects.hashCode(this.values);
        hash = 37 * hash + Objects.hashCode(this.unrecognized);
        hash = 37 * hash + Objects.hashCode(this.colorMapName);
        hash = 37 * hash + Objects.hashCode(this.yAscendsUpward);
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
        final ScaleConfig other = (ScaleConfig) obj;
        return Objects.equals(this.values, other.values)
                && Objects.equals(this.unrecognized, other.unrecognized)
                && Objects.equals(this.colorMapName, other.colorMapName)
                && Objects.equals(this.yAscendsUpward, other.yAscendsUpward);
    }
}
