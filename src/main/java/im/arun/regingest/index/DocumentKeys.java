package im.arun.regingest.index;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builders for content-stable document keys.
 */
public final class DocumentKeys {

    private DocumentKeys() {}

    /**
     * {@code prefix_id}, for records that carry an upstream identifier.
     */
    public static String of(String prefix, Object id) {
        if (id == null || String.valueOf(id).isBlank()) {
            throw new IllegalArgumentException("Missing identifier for " + prefix + " document");
        }
        return prefix + "_" + id;
    }

    /**
     * Hex SHA-256 of the parts joined with underscores. {@code null} parts render as "None"
     * so that keys built before and after a field became optional stay equal.
     */
    public static String sha256(Object... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('_');
            }
            sb.append(parts[i] == null ? "None" : parts[i]);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
