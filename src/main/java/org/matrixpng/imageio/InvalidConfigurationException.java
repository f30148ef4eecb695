package org.matrixpng.imageio;

/**
 * Thrown when a codec setting (mode, bit depth, color map, scale) cannot be
 * used to build an image.
 *
 * @author tonyj
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
