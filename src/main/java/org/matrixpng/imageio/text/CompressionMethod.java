package org.matrixpng.imageio.text;

/**
 * Compression methods a text record may declare. Only zlib is defined.
 *
 * @author tonyj
 */
public enum CompressionMethod {

    ZLIB(0);

    private final int code;

    CompressionMethod(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    static CompressionMethod fromCode(int code) throws UnsupportedCompressionMethodException {
        for (CompressionMethod method : values()) {
            if (method.code == code) {
                return method;
            }
        }
        throw new UnsupportedCompressionMethodException(code);
    }
}
