package org.matrixpng.imageio.text;

/**
 * The record bytes do not have the expected field structure.
 *
 * @author tonyj
 */
public class MalformedMetadataRecordException extends MetadataFormatException {

    private static final long serialVersionUID = 1L;

    public MalformedMetadataRecordException(String message) {
        super(message);
    }

    public MalformedMetadataRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
