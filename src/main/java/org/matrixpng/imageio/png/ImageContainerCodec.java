package org.matrixpng.imageio.png;

import java.io.IOException;
import java.util.List;
import org.matrixpng.imageio.PixelBuffer;

/**
 * The image file format: pixel encode/decode plus access to the file's
 * ordered chunk list.
 *
 * @author tonyj
 */
public interface ImageContainerCodec {

    /**
     * @param pixels The pixels, with their mode and bit depth
     * @return A complete image file
     * @throws IOException If the pixels cannot be encoded
     */
    byte[] encode(PixelBuffer pixels) throws IOException;

    /**
     * @param image A complete image file
     * @return The decoded samples, with no color to value mapping applied
     * @throws IOException If the file cannot be decoded
     */
    PixelBuffer decode(byte[] image) throws IOException;

    /**
     * @param image A complete image file
     * @return Every chunk in file order, ending with the terminal chunk
     * @throws IOException If the file structure is invalid
     */
    List<PngChunk> readChunks(byte[] image) throws IOException;

    /**
     * @param chunks The chunks in file order, ending with the terminal chunk
     * @return A complete image file
     * @throws IOException If the chunks do not form a valid file
     */
    byte[] writeChunks(List<PngChunk> chunks) throws IOException;

    /**
     * Insert a chunk immediately before the terminal chunk.
     *
     * @param chunks The chunk list to modify
     * @param chunk The chunk to insert
     * @throws IOException If the list has no terminal chunk
     */
    default void insertBeforeEnd(List<PngChunk> chunks, PngChunk chunk) throws IOException {
        for (int i = chunks.size() - 1; i >= 0; i--) {
            if (PngChunk.IEND.equals(chunks.get(i).getType())) {
                chunks.add(i, chunk);
                return;
            }
        }
        throw new IOException("Missing " + PngChunk.IEND + " chunk");
    }
}
