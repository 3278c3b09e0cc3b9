package io.github.yok.itgluemigrate.document;

import com.google.common.collect.ImmutableMap;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Detects the MIME type of document images.
 *
 * @author Yasuharu.Okawauchi
 */
public final class ImageTypes {

    /**
     * Fallback when neither the extension nor the content identifies the image.
     */
    public static final String DEFAULT_TYPE = "image/png";

    private static final Map<String, String> BY_EXTENSION = ImmutableMap.<String, String>builder()
            .put("jpg", "image/jpeg")
            .put("jpeg", "image/jpeg")
            .put("png", "image/png")
            .put("gif", "image/gif")
            .put("bmp", "image/bmp")
            .put("webp", "image/webp")
            .put("svg", "image/svg+xml")
            .put("ico", "image/x-icon")
            .put("tiff", "image/tiff")
            .put("tif", "image/tiff")
            .build();

    private static final Map<String, String> EXTENSION_FOR_TYPE =
            ImmutableMap.<String, String>builder()
                    .put("image/png", ".png")
                    .put("image/jpeg", ".jpg")
                    .put("image/gif", ".gif")
                    .put("image/webp", ".webp")
                    .put("image/bmp", ".bmp")
                    .put("image/svg+xml", ".svg")
                    .build();

    private static final byte[] PNG_MAGIC =
            {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8};
    private static final byte[] GIF87_MAGIC = "GIF87a".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] GIF89_MAGIC = "GIF89a".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] RIFF_MAGIC = "RIFF".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] WEBP_MAGIC = "WEBP".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] BMP_MAGIC = "BM".getBytes(StandardCharsets.US_ASCII);

    private ImageTypes() {
        // Utility class; do not instantiate.
    }

    /**
     * Determines the MIME type from the file name, falling back to the content.
     *
     * @param filename file name
     * @param content file bytes
     * @return MIME type, {@link #DEFAULT_TYPE} when unknown
     */
    public static String detect(String filename, byte[] content) {
        String ext = FilenameUtils.getExtension(StringUtils.defaultString(filename));
        String byExt = BY_EXTENSION.get(ext.toLowerCase(Locale.ROOT));
        if (byExt != null) {
            return byExt;
        }
        return sniff(content);
    }

    /**
     * Identifies PNG, JPEG, GIF, WebP and BMP content by its leading bytes.
     *
     * @param content file bytes
     * @return MIME type, {@link #DEFAULT_TYPE} when unknown
     */
    public static String sniff(byte[] content) {
        if (content == null) {
            return DEFAULT_TYPE;
        }
        if (startsWith(content, PNG_MAGIC, 0)) {
            return "image/png";
        }
        if (startsWith(content, JPEG_MAGIC, 0)) {
            return "image/jpeg";
        }
        if (startsWith(content, GIF87_MAGIC, 0) || startsWith(content, GIF89_MAGIC, 0)) {
            return "image/gif";
        }
        if (startsWith(content, RIFF_MAGIC, 0) && startsWith(content, WEBP_MAGIC, 8)) {
            return "image/webp";
        }
        if (startsWith(content, BMP_MAGIC, 0)) {
            return "image/bmp";
        }
        return DEFAULT_TYPE;
    }

    /**
     * Appends an extension matching the content type when the name has none.
     *
     * @param filename file name
     * @param contentType detected MIME type
     * @return the name, with an extension
     */
    public static String ensureExtension(String filename, String contentType) {
        if (StringUtils.isNotEmpty(FilenameUtils.getExtension(filename))) {
            return filename;
        }
        return filename + EXTENSION_FOR_TYPE.getOrDefault(contentType, ".png");
    }

    private static boolean startsWith(byte[] content, byte[] magic, int offset) {
        if (content.length < offset + magic.length) {
            return false;
        }
        return Arrays.equals(content, offset, offset + magic.length, magic, 0, magic.length);
    }
}
