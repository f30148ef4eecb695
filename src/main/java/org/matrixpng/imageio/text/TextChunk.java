package org.matrixpng.imageio.text;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One international text record, laid out like the data of a PNG iTXt chunk.
 * Instances are immutable.
 *
 * @author tonyj
 */
public class TextChunk {

    public static final String DEFAULT_LANGUAGE = "en-us";
    static final int MAX_KEYWORD_LENGTH = 79;

    private final String keyword;
    private final boolean compressed;
    private final CompressionMethod compressionMethod;
    private final String languageTag;
    private final String translatedKeyword;
    private final String text;

    /**
     * A zlib compressed record in the default language, with the translated
     * keyword equal to the keyword.
     */
    public TextChunk(String keyword, String text) {
        this(keyword, true, CompressionMethod.ZLIB, DEFAULT_LANGUAGE, keyword, text);
    }

    /**
     * @param keyword 1 to 79 Latin-1 characters, no NUL
     * @param compressed Whether the text is stored zlib compressed
     * @param compressionMethod The compression method, only zlib exists
     * @param languageTag ASCII, no NUL, may be empty
     * @param translatedKeyword Any text without NUL, may be empty
     * @param text The payload
     * @throws IllegalArgumentException if a field cannot be encoded
     */
    public TextChunk(String keyword, boolean compressed, CompressionMethod compressionMethod, String languageTag, String translatedKeyword, String text) {
        Objects.requireNonNull(compressionMethod, "compressionMethod");
        if (keyword == null || keyword.isEmpty() || keyword.length() > MAX_KEYWORD_LENGTH) {
            throw new IllegalArgumentException("Keyword must be 1 to " + MAX_KEYWORD_LENGTH + " characters: " + keyword);
        }
        checkNoNul("keyword", keyword);
        if (!StandardCharsets.ISO_8859_1.newEncoder().canEncode(keyword)) {
            throw new IllegalArgumentException("Keyword is not Latin-1: " + keyword);
        }
        checkNoNul("language tag", Objects.requireNonNull(languageTag, "languageTag"));
        if (!StandardCharsets.US_ASCII.newEncoder().canEncode(languageTag)) {
            throw new IllegalArgumentException("Language tag is not ASCII: " + languageTag);
        }
        checkNoNul("translated keyword", Objects.requireNonNull(translatedKeyword, "translatedKeyword"));
        this.keyword = keyword;
        this.compressed = compressed;
        this.compressionMethod = compressionMethod;
        this.languageTag = languageTag;
        this.translatedKeyword = translatedKeyword;
        this.text = Objects.requireNonNull(text, "text");
    }

    private static void checkNoNul(String field, String value) {
        if (value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("The " + field + " may not contain NUL");
        }
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isCompressed() {
        return compressed;
    }

    public CompressionMethod getCompressionMethod() {
        return compressionMethod;
    }

    public String getLanguageTag() {
        return languageTag;
    }

    public String getTranslatedKeyword() {
        return translatedKeyword;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "TextChunk{" + "keyword=" + keyword + ", compressed=" + compressed + ", compressionMethod=" + compressionMethod
                + ", languageTag=" + languageTag + ", translatedKeyword=" + translatedKeyword + ", text=" + text + '}';
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 59 * hash + Objects.hashCode(this.keyword);
        hash = 59 * hash + (this.compressed ? 1 : 0);
        hash = 59 * hash + Objects.hashCode(this.compressionMethod);
        hash = 59 * hash + Objects.hashCode(this.languageTag);
        hash = 59 * hash + Objects.hashCode(this.translatedKeyword);
        hash = 59 * hash + Objects.hashCode(this.text);
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
        final TextChunk other = (TextChunk) obj;
        return this.compressed == other.compressed
                && this.compressionMethod == other.compressionMethod
                && Objects.equals(this.keyword, other.keyword)
                && Objects.equals(this.languageTag, other.languageTag)
                && Objects.equals(this.translatedKeyword, other.translatedKeyword)
                && Objects.equals(this.text, other.text);
    }
}
