package org.matrixpng.imageio;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The keywords persisted as image metadata records. Anything else read from
 * an image maps to {@link #UNRECOGNIZED}.
 *
 * @author tonyj
 */
public enum MetadataKeyword {

    Z_MIN("z_min", true),
    Z_MAX("z_max", true),
    Z_UNITS("z_units", true),
    X_MIN("x_min", true),
    X_MAX("x_max", true),
    X_UNITS("x_units", true),
    Y_MIN("y_min", true),
    Y_MAX("y_max", true),
    Y_UNITS("y_units", true),
    COLORMAP("colormap", false),
    Y_ASCEND("y_ascend", false),
    UNRECOGNIZED(null, false);

    /**
     * The scale fields, in the order their records are written.
     */
    public static final List<MetadataKeyword> SCALE_FIELDS;

    static {
        List<MetadataKeyword> fields = new ArrayList<>();
        for (MetadataKeyword keyword : values()) {
            if (keyword.scaleField) {
                fields.add(keyword);
            }
        }
        SCALE_FIELDS = Collections.unmodifiableList(fields);
    }

    private final String keyword;
    private final boolean scaleField;

    MetadataKeyword(String keyword, boolean scaleField) {
        this.keyword = keyword;
        this.scaleField = scaleField;
    }

    /**
     * @return The keyword as written in the record, or null for
     * {@link #UNRECOGNIZED}
     */
    public String getKeyword() {
        return keyword;
    }

    public boolean isScaleField() {
        return scaleField;
    }

    public static MetadataKeyword of(String keyword) {
        for (MetadataKeyword k : values()) {
            if (k.keyword != null && k.keyword.equals(keyword)) {
                return k;
            }
        }
        return UNRECOGNIZED;
    }
}
