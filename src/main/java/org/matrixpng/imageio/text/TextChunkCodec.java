package org.matrixpng.imageio.text;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Converts {@link TextChunk}s to and from their binary form:
 * <pre>
 * keyword            Latin-1, NUL terminated
 * compressed flag    1 byte, 0 or 1
 * compression method 1 byte, 0 = zlib
 * language tag       ASCII, NUL terminated
 * translated keyword UTF-8, NUL terminated
 * text               UTF-8, zlib compressed if the flag is 1
 * </pre>
 * Decoding accepts untrusted bytes and reports every structural problem as a
 * {@link MetadataFormatException}.
 *
 * @author tonyj
 */
public class TextChunkCodec {

    private static final Logger LOG = Logger.getLogger(TextChunkCodec.class.getName());

    /**
     * The PNG chunk type carrying these records.
     */
    public static final String CHUNK_TYPE = "iTXt";

    private static final byte NUL = 0;
    private static final int BUFFER_SIZE = 1024;

    private TextChunkCodec() {
    }

    public static byte[] encode(TextChunk chunk) {
        byte[] text = chunk.getText().getBytes(StandardCharsets.UTF_8);
        if (chunk.isCompressed()) {
            text = deflate(text);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(chunk.getKeyword().getBytes(StandardCharsets.ISO_8859_1));
        out.write(NUL);
        out.write(chunk.isCompressed() ? 1 : 0);
        out.write(chunk.getCompressionMethod().getCode());
        out.writeBytes(chunk.getLanguageTag().getBytes(StandardCharsets.US_ASCII));
        out.write(NUL);
        out.writeBytes(chunk.getTranslatedKeyword().getBytes(StandardCharsets.UTF_8));
        out.write(NUL);
        out.writeBytes(text);
        LOG.log(Level.FINE, "Encoded {0} record, {1} bytes", new Object[]{chunk.getKeyword(), out.size()});
        return out.toByteArray();
    }

    public static TextChunk decode(byte[] data) throws MetadataFormatException {
        int keywordEnd = indexOfNul(data, 0);
        if (keywordEnd < 0) {
            throw new MalformedMetadataRecordException("Missing NUL after keyword");
        }
        if (keywordEnd == 0 || keywordEnd > TextChunk.MAX_KEYWORD_LENGTH) {
            throw new MalformedMetadataRecordException("Keyword length " + keywordEnd + " outside 1 to " + TextChunk.MAX_KEYWORD_LENGTH);
        }
        int flags = keywordEnd + 1;
        if (flags + 2 > data.length) {
            throw new MalformedMetadataRecordException("Record truncated before compression flags");
        }
        int compressedFlag = data[flags] & 0xff;
        if (compressedFlag > 1) {
            throw new MalformedMetadataRecordException("Invalid compression flag: " + compressedFlag);
        }
        CompressionMethod method = CompressionMethod.fromCode(data[flags + 1] & 0xff);
        int languageStart = flags + 2;
        int languageEnd = indexOfNul(data, languageStart);
        if (languageEnd < 0) {
            throw new MalformedMetadataRecordException("Missing NUL after language tag");
        }
        int translatedStart = languageEnd + 1;
        int translatedEnd = indexOfNul(data, translatedStart);
        if (translatedEnd < 0) {
            throw new MalformedMetadataRecordException("Missing NUL after translated keyword");
        }
        int textStart = translatedEnd + 1;

        String keyword = new String(data, 0, keywordEnd, StandardCharsets.ISO_8859_1);
        String language = decodeAscii(data, languageStart, languageEnd);
        String translatedKeyword = decodeUtf8(data, translatedStart, translatedEnd, "translated keyword");
        String text;
        if (compressedFlag == 1) {
            byte[] inflated = inflate(data, textStart, data.length - textStart);
            text = decodeUtf8(inflated, 0, inflated.length, "text");
        } else {
            text = decodeUtf8(data, textStart, data.length, "text");
        }
        return new TextChunk(keyword, compressedFlag == 1, method, language, translatedKeyword, text);
    }

    private static int indexOfNul(byte[] data, int from) {
        for (int i = from; i < data.length; i++) {
            if (data[i] == NUL) {
                return i;
            }
        }
        return -1;
    }

    private static String decodeAscii(byte[] data, int start, int end) throws MalformedMetadataRecordException {
        for (int i = start; i < end; i++) {
            if ((data[i] & 0x80) != 0) {
                throw new MalformedMetadataRecordException("Language tag is not ASCII");
            }
        }
        return new String(data, start, end - start, StandardCharsets.US_ASCII);
    }

    private static String decodeUtf8(byte[] data, int start, int end, String field) throws MalformedMetadataRecordException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data, start, end - start))
                    .toString();
        } catch (CharacterCodingException x) {
            throw new MalformedMetadataRecordException("Invalid UTF-8 in " + field, x);
        }
    }

    private static byte[] deflate(byte[] input) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                int l = deflater.deflate(buffer);
                out.write(buffer, 0, l);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static byte[] inflate(byte[] data, int offset, int length) throws DecompressionFailureException {
        // We use inflater directly so truncated and trailing data can be detected
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(data, offset, length);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!inflater.finished()) {
                int l = inflater.inflate(buffer);
                if (l == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DecompressionFailureException("Truncated zlib stream");
                }
                out.write(buffer, 0, l);
            }
            if (inflater.getRemaining() > 0) {
                throw new DecompressionFailureException(inflater.getRemaining() + " bytes after end of zlib stream");
            }
            return out.toByteArray();
        } catch (DataFormatException x) {
            throw new DecompressionFailureException("Error decompressing text", x);
        } finally {
            inflater.end();
        }
    }
}
