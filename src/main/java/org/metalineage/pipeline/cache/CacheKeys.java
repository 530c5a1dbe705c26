package org.metalineage.pipeline.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.TreeSet;

/**
 * Derives content-addressed cache keys from candidate lists.
 * <p>
 * The key is the SHA-256 over the newline-joined, sorted and deduplicated identifiers,
 * rendered as lowercase hex, so any permutation of the same candidates maps to the same key.
 */
public final class CacheKeys {

    private CacheKeys() {
        // Utility class - no instantiation
    }

    /**
     * @param candidateIds candidate identifiers in any order
     * @return 64-character hex key
     */
    public static String stableHash(Collection<String> candidateIds) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        String joined = String.join("\n", sorted(candidateIds));
        return HexFormat.of().formatHex(digest.digest(joined.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * @return the identifiers sorted lexicographically without duplicates
     */
    public static List<String> sorted(Collection<String> candidateIds) {
        return new ArrayList<>(new TreeSet<>(candidateIds));
    }

    /**
     * @return {@code true} if the name looks like a key produced by {@link #stableHash}
     */
    public static boolean isCacheKey(String name) {
        if (name.length() != 64) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }
}
