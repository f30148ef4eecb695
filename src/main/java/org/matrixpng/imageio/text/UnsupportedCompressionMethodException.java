package org.matrixpng.imageio.text;

/**
 * The record names a compression method other than zlib.
 *
 * @author tonyj
 */
public class UnsupportedCompressionMethodException extends MetadataFormatException {

    private static final long serialVersionUID = 1L;

    private final int method;

    public UnsupportedCompressionMethodException(int method) {
        super("Unknown compression method: " + method);
        this.method = method;
    }

    public int getMethod() {
        return method;
    }
}
