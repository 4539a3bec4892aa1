package io.sagescan.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes deterministic issue ids.
 * <p>
 * An id is the first 12 hex characters of the MD5 digest of {@code path:checkId:line}.
 * Re-analysing unchanged input reproduces the same id; ids are not unique across
 * different checks firing at the same place.
 */
public final class IssueIds {

    private static final int ID_LENGTH = 12;

    private IssueIds() {
    }

    public static String of(String filePath, String checkId, int line) {
        String data = filePath + ":" + checkId + ":" + line;
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(data.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships MD5
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
