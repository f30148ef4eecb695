package org.matrixpng.imageio.text;

/**
 * The compressed text of a record could not be inflated.
 *
 * @author tonyj
 */
public class DecompressionFailureException extends MetadataFormatException {

    private static final long serialVersionUID = 1L;

    public DecompressionFailureException(String message) {
        super(message);
    }

    public DecompressionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
