package org.matrixpng.imageio.text;

import java.io.IOException;

/**
 * Base class for errors found while decoding a metadata record.
 *
 * @author tonyj
 */
public class MetadataFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public MetadataFormatException(String message) {
        super(message);
    }

    public MetadataFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
