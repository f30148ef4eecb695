package org.matrixpng.imageio.png;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * One opaque PNG chunk: a four letter type and its data.
 *
 * @see <a href="https://www.w3.org/TR/png/#5Chunk-layout">PNG chunk layout</a>
 * @author tonyj
 */
public class PngChunk {

    public static final String IEND = "IEND";

    private final String type;
    private final byte[] data;

    public PngChunk(String type, byte[] data) {
        if (type == null || type.length() != 4 || !type.chars().allMatch(c -> (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z'))) {
            throw new IllegalArgumentException("Invalid chunk type: " + type);
        }
        this.type = type;
        this.data = data.clone();
    }

    public String getType() {
        return type;
    }

    public byte[] getData() {
        return data.clone();
    }

    public int getLength() {
        return data.length;
    }

    /**
     * @return The CRC-32 of the type and data, as stored after the chunk
     */
    public int crc() {
        CRC32 crc = new CRC32();
        crc.update(type.getBytes(StandardCharsets.US_ASCII));
        crc.update(data);
        return (int) crc.getValue();
    }

    @Override
    public String toString() {
        return "PngChunk{" + "type=" + type + ", length=" + data.length + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 41 * hash + Objects.hashCode(this.type);
        hash = 41 * hash + Arrays.hashCode(this.data);
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
        final PngChunk other = (PngChunk) obj;
        return Objects.equals(this.type, other.type) && Arrays.equals(this.data, other.data);
    }
}
