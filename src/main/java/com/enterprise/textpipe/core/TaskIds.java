package com.enterprise.textpipe.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

/**
 * Task identity: deterministic ids derived from document content.
 * A generated id is "0x" followed by the 32 hex digits of the MD5 digest of the UTF-8 bytes.
 */
public final class TaskIds {

    public static final String PREFIX = "0x";
    public static final int LENGTH = 34;

    private static final Pattern GENERATED_ID = Pattern.compile("0x[0-9a-fA-F]{32}");
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_\\-][A-Za-z0-9_.\\-]*");
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private TaskIds() {
    }

    /**
     * Id of the given document. A document that already looks like a generated id is returned unchanged.
     */
    public static String identity(String doc) {
        if (looksLikeId(doc)) {
            return doc;
        }
        byte[] digest = md5().digest(doc.getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder(LENGTH).append(PREFIX);
        for (byte b : digest) {
            sb.append(HEX[(b >> 4) & 0xf]).append(HEX[b & 0xf]);
        }
        return sb.toString();
    }

    /**
     * Explicit id if given, otherwise the content id of the document
     */
    public static String resolve(String doc, String explicitId) {
        return explicitId != null ? explicitId : identity(doc);
    }

    public static boolean looksLikeId(String value) {
        return value != null && value.length() == LENGTH && GENERATED_ID.matcher(value).matches();
    }

    /**
     * Module names and ids double as storage keys and URL path segments.
     */
    public static String requireSafeName(String value, String what) {
        if (value == null || !SAFE_NAME.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": " + value);
        }
        return value;
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships MD5
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }
}
