package app.slidecraft.pipeline.image;

import app.slidecraft.pipeline.domain.type.PresentationStyle;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

public final class ImageCacheKeys {

    private ImageCacheKeys() {
    }

    /**
     * SHA-256 over the normalized prompt and every input that changes the rendered image.
     */
    public static String compute(String prompt, PresentationStyle style, int width, int height, String model) {
        String material = String.join("|",
                normalize(prompt),
                String.valueOf(width),
                String.valueOf(height),
                style == null ? PresentationStyle.DEFAULT.code() : style.code(),
                normalize(model));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    public static String blobKey(String cacheKey, String extension) {
        return "cache/" + cacheKey.substring(0, 2) + "/" + cacheKey + "." + extension;
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
